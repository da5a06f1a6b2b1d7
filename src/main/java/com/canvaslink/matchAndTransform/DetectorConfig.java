package com.canvaslink.matchAndTransform;

import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

/**
 * Detector selection and tuning. Each variant reads only the parameters that apply to it:
 * <ul>
 *     <li>ORB: featureCount, scaleFactor, levels</li>
 *     <li>KAZE: extended, upright, threshold, levels (octaves), octaveLayers</li>
 *     <li>AKAZE: descriptorType, threshold, levels (octaves), octaveLayers</li>
 *     <li>BRISK: threshold (FAST/AGAST score), levels (octaves)</li>
 *     <li>SURF: threshold (Hessian), levels (octaves), octaveLayers, extended, upright</li>
 *     <li>SIFT: featureCount, octaveLayers, threshold (contrast)</li>
 * </ul>
 */
@Getter
@Builder(toBuilder = true)
@ToString
public class DetectorConfig {
    /** OpenCV AKAZE::DESCRIPTOR_KAZE_UPRIGHT, float descriptors. */
    public static final int AKAZE_DESCRIPTOR_KAZE_UPRIGHT = 2;
    /** OpenCV AKAZE::DESCRIPTOR_KAZE, float descriptors. */
    public static final int AKAZE_DESCRIPTOR_KAZE = 3;
    /** OpenCV AKAZE::DESCRIPTOR_MLDB, binary descriptors. */
    public static final int AKAZE_DESCRIPTOR_MLDB = 5;

    private final DetectorType type;
    private final int featureCount;
    private final double scaleFactor;
    private final int levels;
    private final int octaveLayers;
    private final double threshold;
    private final boolean extended;
    private final boolean upright;
    private final int descriptorType;

    /**
     * The tuning the variant is normally run with.
     */
    public static DetectorConfig defaults(DetectorType type) {
        DetectorConfigBuilder builder = DetectorConfig.builder().type(type);
        switch (type) {
            case ORB:
                return builder.featureCount(500).scaleFactor(1.2).levels(8).build();
            case KAZE:
                return builder.threshold(0.001).levels(4).octaveLayers(4).build();
            case AKAZE:
                return builder.descriptorType(AKAZE_DESCRIPTOR_KAZE).threshold(0.001).levels(4).octaveLayers(4).build();
            case BRISK:
                return builder.threshold(30).levels(3).build();
            case SURF:
                return builder.threshold(400).levels(4).octaveLayers(3).build();
            case SIFT:
                return builder.featureCount(0).octaveLayers(3).threshold(0.04).build();
            default:
                throw new IllegalArgumentException("Unknown detector type " + type);
        }
    }
}
