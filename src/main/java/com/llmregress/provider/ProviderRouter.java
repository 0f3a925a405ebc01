package com.llmregress.provider;

import java.util.Map;
import java.util.Set;

public class ProviderRouter implements ProviderClient {
    private final Map<String, ProviderClient> clients;

    public ProviderRouter(Map<String, ProviderClient> clients) {
        this.clients = Map.copyOf(clients);
    }

    @Override
    public Completion invoke(String prompt, ModelConfig model) throws ProviderException {
        ProviderClient client = clients.get(model.provider());
        if (client == null) {
            throw new ProviderPermanentException("No client configured for provider '" + model.provider() + "'");
        }
        return client.invoke(prompt, model);
    }

    public Set<String> providers() {
        return clients.keySet();
    }
}
