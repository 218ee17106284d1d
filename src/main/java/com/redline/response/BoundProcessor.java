package com.redline.response;

import java.util.ArrayList;
import java.util.List;

/**
 * A {@link ResponseProcessor} registration: the processor plus the metadata type that triggers it.
 * {@link #bind(List)} pairs it with the matching metadata of one route.
 */
public class BoundProcessor {
    private final Class<?> metadataType;
    private final ResponseProcessor processor;
    private final Object metadata;

    /**
     * Creates a registration.
     *
     * @param metadataType the metadata type that triggers the processor, or null to apply it to
     *     every route
     * @param processor the processor
     */
    public BoundProcessor(Class<?> metadataType, ResponseProcessor processor) {
        this(metadataType, processor, null);
    }

    private BoundProcessor(Class<?> metadataType, ResponseProcessor processor, Object metadata) {
        this.metadataType = metadataType;
        this.processor = processor;
        this.metadata = metadata;
    }

    /**
     * Pairs this registration with a route's metadata.
     *
     * @param routeMetadata the metadata attached to the route
     * @return one bound processor per matching metadata instance; a single unbound one for a
     *     global processor
     */
    public List<BoundProcessor> bind(List<Object> routeMetadata) {
        List<BoundProcessor> bound = new ArrayList<>();
        if (metadataType == null) {
            bound.add(this);
            return bound;
        }
        for (Object candidate : routeMetadata) {
            if (metadataType.isInstance(candidate)) {
                bound.add(new BoundProcessor(metadataType, processor, candidate));
            }
        }
        return bound;
    }

    public Class<?> getMetadataType() {
        return metadataType;
    }

    public ResponseProcessor getProcessor() {
        return processor;
    }

    public Object getMetadata() {
        return metadata;
    }
}
