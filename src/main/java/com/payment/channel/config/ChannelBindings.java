package com.payment.channel.config;

import com.payment.channel.core.ChannelBinding;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * All configured channel bindings by name. Built once at startup.
 */
public class ChannelBindings {

    private final Map<String, ChannelBinding> bindings;

    public ChannelBindings(Collection<ChannelBinding> bindings) {
        Map<String, ChannelBinding> byName = new LinkedHashMap<>();
        bindings.forEach(binding -> byName.put(binding.getName(), binding));
        this.bindings = Collections.unmodifiableMap(byName);
    }

    public Optional<ChannelBinding> find(String name) {
        return Optional.ofNullable(bindings.get(name));
    }

    public ChannelBinding get(String name) {
        return find(name).orElseThrow(() -> new IllegalArgumentException(
                "Unknown payment channel binding: " + name + ". Available: " + bindings.keySet()));
    }

    public Collection<ChannelBinding> all() {
        return bindings.values();
    }

    public int size() {
        return bindings.size();
    }
}
