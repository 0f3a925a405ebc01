package com.llmregress.expand;

import java.util.Map;
import java.util.Set;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;

class TemplateRendererTest {

    @Test
    void shouldSubstituteEveryPlaceholder() {
        String rendered = TemplateRenderer.render("Say hello to {{name}} from {{ city }}, {{name}}!",
                Map.of("name", "Alice", "city", "Paris"));

        assertEquals("Say hello to Alice from Paris, Alice!", rendered);
    }

    @Test
    void shouldInsertValuesLiterally() {
        String rendered = TemplateRenderer.render("cost: {{price}}", Map.of("price", "$5 \\ {{name}}"));

        assertEquals("cost: $5 \\ {{name}}", rendered);
    }

    @Test
    void shouldFailOnMissingVariable() {
        TemplateException error = assertThrows(TemplateException.class,
                () -> TemplateRenderer.render("Hi {{name}}, meet {{missing}}", Map.of("name", "Alice")));

        assertEquals(Set.of("missing"), error.missingVariables());
    }

    @Test
    void shouldPassThroughTextWithoutPlaceholders() {
        assertEquals("plain text", TemplateRenderer.render("plain text", Map.of()));
        assertNull(TemplateRenderer.render(null, Map.of()));
    }
}
