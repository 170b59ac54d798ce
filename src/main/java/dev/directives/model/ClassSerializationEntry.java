package dev.directives.model;

/**
 * A class that needs a class-serialization registration.
 *
 * @param customSerialization true when the class defines both the serialize and deserialize hooks
 * @param ownsStepMethods     true when at least one of its methods is a step, so {@code this} has to
 *                            cross the step boundary
 */
public record ClassSerializationEntry(
    String className,
    String id,
    boolean customSerialization,
    boolean ownsStepMethods
) {}
