package com.questrail.phaseseq.api;

/**
 * Scalar acquisition parameters carried alongside a frame sequence and written
 * into the container header.
 *
 * @param pixelSize        physical pixel size in metres
 * @param wavelengthNm     illumination wavelength in nanometres
 * @param refractiveIndex1 refractive index of the first medium
 * @param refractiveIndex2 refractive index of the second medium
 */
public record AcquisitionMetadata(
        float pixelSize,
        float wavelengthNm,
        float refractiveIndex1,
        float refractiveIndex2
) {
    public static final float DEFAULT_PIXEL_SIZE = 1.1520307e-6f;
    public static final float DEFAULT_WAVELENGTH_NM = 665.8f;
    public static final float DEFAULT_REFRACTIVE_INDEX_1 = 1.0f;
    public static final float DEFAULT_REFRACTIVE_INDEX_2 = 2.0f;

    public AcquisitionMetadata {
        requireFinite(pixelSize, "pixelSize");
        requireFinite(wavelengthNm, "wavelengthNm");
        requireFinite(refractiveIndex1, "refractiveIndex1");
        requireFinite(refractiveIndex2, "refractiveIndex2");
    }

    /**
     * Defaults of the acquisition setup (665.8 nm source, indices 1 and 2).
     */
    public static AcquisitionMetadata defaults() {
        return new AcquisitionMetadata(
                DEFAULT_PIXEL_SIZE,
                DEFAULT_WAVELENGTH_NM,
                DEFAULT_REFRACTIVE_INDEX_1,
                DEFAULT_REFRACTIVE_INDEX_2);
    }

    /**
     * Returns a copy with the pixel size read from a frame header.
     */
    public AcquisitionMetadata withPixelSize(float pixelSize) {
        return new AcquisitionMetadata(pixelSize, wavelengthNm, refractiveIndex1, refractiveIndex2);
    }

    private static void requireFinite(float value, String name) {
        if (!Float.isFinite(value)) {
            throw new IllegalArgumentException(name + " must be finite");
        }
    }
}
