package com.labtrace.lims.api.service.report;

import com.labtrace.lims.api.config.ReportProperties;

public record ConversionOptions(String paperFormat, String marginVertical, String marginHorizontal, boolean printBackground) {
    public static ConversionOptions from(ReportProperties.Converter converter) {
        return new ConversionOptions(
            converter.getPaperFormat(),
            converter.getMarginVertical(),
            converter.getMarginHorizontal(),
            converter.isPrintBackground()
        );
    }
}
