package com.llmgateway.provider;

import com.llmgateway.registry.WireFormat;
import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Looks up the adapter for a descriptor's wire format.
 */
@Component
public class WireAdapters {

    private final Map<WireFormat, WireAdapter> byFormat = new EnumMap<>(WireFormat.class);

    public WireAdapters(List<WireAdapter> adapters) {
        for (WireAdapter adapter : adapters) {
            if (byFormat.putIfAbsent(adapter.format(), adapter) != null) {
                throw new IllegalStateException("Duplicate wire adapter for " + adapter.format());
            }
        }
    }

    public WireAdapter forFormat(WireFormat format) {
        WireAdapter adapter = byFormat.get(format);
        if (adapter == null) {
            throw new IllegalStateException("No wire adapter registered for " + format);
        }
        return adapter;
    }
}
