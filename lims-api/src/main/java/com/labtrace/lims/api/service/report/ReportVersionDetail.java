package com.labtrace.lims.api.service.report;

import java.util.Map;

public record ReportVersionDetail(ReportVersionView version, Map<String, Object> dataSnapshot, String renderedSnapshot) {}
