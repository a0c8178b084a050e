package com.ttennebkram.texturefix.filter;

import com.ttennebkram.texturefix.config.FilterConfig;
import com.ttennebkram.texturefix.mask.Mask;
import com.ttennebkram.texturefix.mask.MaskBuilder;
import com.ttennebkram.texturefix.spectrum.ComplexSpectrum;
import com.ttennebkram.texturefix.spectrum.SpectrumTransform;
import org.opencv.core.Mat;

/**
 * Filters one channel in the frequency domain:
 * forward DFT, mask, multiply, inverse DFT.
 */
public class ChannelFilter {

    private final SpectrumTransform transform;

    public ChannelFilter() {
        this(new SpectrumTransform());
    }

    public ChannelFilter(SpectrumTransform transform) {
        this.transform = transform;
    }

    /**
     * @param channel single-channel Mat (not modified)
     * @return filtered CV_64F channel, not clipped (caller must release)
     */
    public Mat filterChannel(Mat channel, FilterConfig config, MaskBuilder policy) {
        ComplexSpectrum spectrum = transform.forward(channel);
        Mask mask = policy.build(spectrum, config);
        return transform.inverse(spectrum.multiply(mask));
    }
}
