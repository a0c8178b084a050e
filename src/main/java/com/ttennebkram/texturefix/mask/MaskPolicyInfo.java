package com.ttennebkram.texturefix.mask;

import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Annotation for MaskBuilder classes to declare their metadata.
 * MaskBuilderRegistry reads it at runtime to map policy names to builders.
 *
 * Example usage:
 * <pre>
 * {@literal @}MaskPolicyInfo(
 *     name = "peaks",
 *     description = "Notch out outlier-magnitude frequencies"
 * )
 * public class PeakNotchMaskBuilder implements MaskBuilder { ... }
 * </pre>
 */
@Retention(RetentionPolicy.RUNTIME)
@Target(ElementType.TYPE)
public @interface MaskPolicyInfo {

    /**
     * The policy name (e.g., "peaks", "lines").
     * Must match the name used on the command line and in config files.
     */
    String name();

    /**
     * Description shown in the usage text.
     */
    String description() default "";
}
