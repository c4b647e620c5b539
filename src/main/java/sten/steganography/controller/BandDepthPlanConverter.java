package sten.steganography.controller;

import picocli.CommandLine.ITypeConverter;
import picocli.CommandLine.TypeConversionException;
import sten.steganography.codec.BandDepthPlan;

/**
 * Converts {@code r,g,b[,a]} depth lists such as {@code 1,0,2}.
 */
public class BandDepthPlanConverter implements ITypeConverter<BandDepthPlan> {

    @Override
    public BandDepthPlan convert(String value) {
        try {
            return BandDepthPlan.parse(value);
        } catch (IllegalArgumentException e) {
            throw new TypeConversionException(e.getMessage());
        }
    }
}
