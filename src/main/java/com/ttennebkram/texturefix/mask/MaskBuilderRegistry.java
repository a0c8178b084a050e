package com.ttennebkram.texturefix.mask;

import java.util.*;

/**
 * Registry for MaskBuilder implementations.
 * Each builder is keyed by the name in its @MaskPolicyInfo annotation.
 *
 * Usage:
 *   MaskBuilder builder = MaskBuilderRegistry.createBuilder("lines");
 *   Mask mask = builder.build(spectrum, config);
 */
public class MaskBuilderRegistry {

    // Policy name -> builder class, sorted so usage text is stable
    private static final Map<String, Class<? extends MaskBuilder>> builderClasses = new TreeMap<>();
    private static final Map<String, String> descriptions = new TreeMap<>();

    private static boolean initialized = false;

    /**
     * Safe to call multiple times - only initializes once.
     */
    public static synchronized void initialize() {
        if (initialized) return;

        register(PeakNotchMaskBuilder.class);
        register(LineBandMaskBuilder.class);

        initialized = true;
    }

    private static void register(Class<? extends MaskBuilder> builderClass) {
        MaskPolicyInfo info = builderClass.getAnnotation(MaskPolicyInfo.class);
        if (info == null) {
            throw new IllegalStateException(builderClass.getName() + " is missing @MaskPolicyInfo");
        }
        builderClasses.put(info.name(), builderClass);
        descriptions.put(info.name(), info.description());
    }

    public static synchronized boolean hasPolicy(String name) {
        initialize();
        return builderClasses.containsKey(name);
    }

    /**
     * Create a new builder for the given policy name.
     *
     * @throws IllegalArgumentException if no builder is registered under that name
     */
    public static synchronized MaskBuilder createBuilder(String name) {
        initialize();
        Class<? extends MaskBuilder> builderClass = builderClasses.get(name);
        if (builderClass == null) {
            throw new IllegalArgumentException("Unknown filter method '" + name
                + "', expected one of " + builderClasses.keySet());
        }
        try {
            return builderClass.getDeclaredConstructor().newInstance();
        } catch (ReflectiveOperationException e) {
            throw new IllegalStateException("Failed to create mask builder for " + name, e);
        }
    }

    /**
     * Get all registered policy names.
     */
    public static synchronized Set<String> getRegisteredPolicies() {
        initialize();
        return Collections.unmodifiableSet(new TreeSet<>(builderClasses.keySet()));
    }

    public static synchronized String getDescription(String name) {
        initialize();
        return descriptions.getOrDefault(name, "");
    }
}
