package com.ttennebkram.texturefix.mask;

import com.ttennebkram.texturefix.config.FilterConfig;
import com.ttennebkram.texturefix.spectrum.ComplexSpectrum;

/**
 * A policy for building an attenuation mask over a centered spectrum.
 * Implementations are annotated with {@link MaskPolicyInfo} and created
 * through {@link MaskBuilderRegistry}.
 *
 * Implementations must be stateless and must leave the protect-center disc
 * at exactly 1.0 in the returned mask.
 */
public interface MaskBuilder {

    /**
     * Policy name used on the command line and in config files (e.g. "peaks").
     */
    String getPolicyName();

    /**
     * Build a mask of the same shape as the spectrum.
     *
     * @param spectrum centered spectrum of one channel (not modified)
     * @param config   filter parameters; only the fields of this policy are read
     */
    Mask build(ComplexSpectrum spectrum, FilterConfig config);
}
