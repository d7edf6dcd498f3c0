package com.labtrace.lims.api.service.report;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.springframework.stereotype.Component;
import org.springframework.web.util.HtmlUtils;

/**
 * Certificate of analysis as a self-contained HTML page. Column order, labels and visibility of the test table come
 * from the {@code templateSettings} captured in the snapshot.
 */
@Component
public class HtmlReportRenderer implements ReportRenderer {

    static final List<String> DEFAULT_COLUMNS = List.of(
        "section",
        "test",
        "method",
        "specification",
        "result",
        "unit",
        "testDate",
        "analyst",
        "checkedBy",
        "checkedDate",
        "oos",
        "comments"
    );

    static final Map<String, String> DEFAULT_LABELS;

    static {
        Map<String, String> labels = new LinkedHashMap<>();
        labels.put("section", "Section");
        labels.put("test", "Test");
        labels.put("method", "Method");
        labels.put("specification", "Specification");
        labels.put("result", "Result");
        labels.put("unit", "Unit");
        labels.put("status", "Status");
        labels.put("dueDate", "Due Date");
        labels.put("testDate", "Test Date");
        labels.put("analyst", "Analyst");
        labels.put("checkedBy", "Checked By");
        labels.put("checkedDate", "Checked Date");
        labels.put("oos", "OOS");
        labels.put("comments", "Comments");
        DEFAULT_LABELS = Map.copyOf(labels);
    }

    private static final String STYLE =
        "body{font-family:Helvetica,Arial,sans-serif;font-size:11px;color:#222}" +
        "h1{font-size:18px;margin:0}table{border-collapse:collapse;width:100%;margin-top:12px}" +
        "th,td{border:1px solid #999;padding:4px;text-align:left}th{background:#eee}" +
        ".oos{color:#b00020;font-weight:bold}.version{float:right;font-weight:bold}.disclaimer{margin-top:16px;font-size:9px}";

    @Override
    public String render(ReportSnapshot snapshot) {
        Map<String, Object> sample = snapshot.section(ReportSnapshotFactory.SAMPLE);
        Map<String, Object> client = snapshot.section(ReportSnapshotFactory.CLIENT);
        Map<String, Object> job = snapshot.section(ReportSnapshotFactory.JOB);
        Map<String, Object> metadata = snapshot.section(ReportSnapshotFactory.METADATA);
        Map<String, Object> template = asMap(metadata.get(ReportSnapshotFactory.TEMPLATE_SETTINGS));
        List<String> columns = columns(template);
        Map<String, Object> labelOverrides = asMap(template.get("labelOverrides"));

        StringBuilder html = new StringBuilder(4096);
        html.append("<!DOCTYPE html><html><head><meta charset=\"utf-8\"><title>Certificate of Analysis ")
            .append(escape(sample.get("sampleCode")))
            .append("</title><style>").append(STYLE).append("</style></head><body>");

        html.append("<header>");
        Object logo = metadata.get("labLogoUrl");
        if (logo != null) {
            html.append("<img class=\"logo\" alt=\"logo\" src=\"").append(escape(logo)).append("\">");
        }
        html.append("<span class=\"version\">Version ").append(snapshot.version()).append("</span>");
        html.append("<h1>").append(escape(metadata.get("labName"))).append("</h1>");
        html.append("<h2>Certificate of Analysis</h2></header>");

        html.append("<table class=\"details\">");
        row(html, "Sample Code", sample.get("sampleCode"));
        row(html, "Client", client.get("name"));
        row(html, "Job Number", job.get("jobNumber"));
        row(html, "Description", sample.get("sampleDescription"));
        row(html, "Batch", sample.get("sampleBatch"));
        row(html, "UIN Code", sample.get("uinCode"));
        row(html, "Supplier", sample.get("rmSupplier"));
        row(html, "Date Received", sample.get("dateReceived"));
        row(html, "Temperature on Receipt (C)", sample.get("temperature"));
        row(html, "Storage Conditions", sample.get("storageConditions"));
        row(html, "Release Date", sample.get("releaseDate"));
        html.append("</table>");

        html.append("<table class=\"tests\"><thead><tr>");
        for (String column : columns) {
            Object label = labelOverrides.getOrDefault(column, DEFAULT_LABELS.getOrDefault(column, column));
            html.append("<th>").append(escape(label)).append("</th>");
        }
        html.append("</tr></thead><tbody>");
        for (Map<String, Object> test : snapshot.tests()) {
            boolean oos = Boolean.TRUE.equals(test.get("oos"));
            html.append(oos ? "<tr class=\"oos\">" : "<tr>");
            for (String column : columns) {
                html.append("<td>").append(escape(cell(column, test.get(column)))).append("</td>");
            }
            html.append("</tr>");
        }
        html.append("</tbody></table>");

        if (sample.get("comments") != null) {
            html.append("<p class=\"comments\">").append(escape(sample.get("comments"))).append("</p>");
        }
        html.append("<footer><p>Generated ").append(escape(metadata.get("generatedAt")));
        if (metadata.get("generatedBy") != null) {
            html.append(" by ").append(escape(metadata.get("generatedBy")));
        }
        html.append("</p><p class=\"disclaimer\">").append(escape(metadata.get("disclaimer"))).append("</p></footer>");
        html.append("</body></html>");
        return html.toString();
    }

    static List<String> columns(Map<String, Object> template) {
        List<String> order = stringList(template.get("columnOrder"));
        if (order.isEmpty()) {
            order = new ArrayList<>(DEFAULT_COLUMNS);
        }
        List<String> visible = stringList(template.get("visibleFields"));
        if (!visible.isEmpty()) {
            order.removeIf(column -> !visible.contains(column));
        }
        return order;
    }

    private static void row(StringBuilder html, String label, Object value) {
        html.append("<tr><th>").append(escape(label)).append("</th><td>").append(escape(value)).append("</td></tr>");
    }

    private static Object cell(String column, Object value) {
        if ("oos".equals(column)) {
            return Boolean.TRUE.equals(value) ? "OOS" : "";
        }
        if ("specification".equals(column) && value instanceof Map<?, ?> spec) {
            return describeSpecification(spec);
        }
        return value;
    }

    static String describeSpecification(Map<?, ?> spec) {
        Object min = spec.get("min");
        Object max = spec.get("max");
        Object unit = spec.get("unit");
        String suffix = unit != null ? " " + unit : "";
        Object comparator = spec.get("comparator");
        Object threshold = spec.get("threshold");
        if (comparator != null && threshold != null) {
            String symbol = comparatorSymbol(String.valueOf(comparator));
            if (symbol != null) {
                return symbol + " " + threshold + suffix;
            }
        }
        if (min != null && max != null) {
            return min + " - " + max + suffix;
        }
        if (min != null) {
            return ">= " + min + suffix;
        }
        if (max != null) {
            return "<= " + max + suffix;
        }
        if (spec.get("target") != null) {
            return String.valueOf(spec.get("target"));
        }
        return spec.get("name") != null ? String.valueOf(spec.get("name")) : "";
    }

    // accepts the enum or its JSON name once the snapshot has been read back
    private static String comparatorSymbol(String comparator) {
        return switch (comparator) {
            case "GTE" -> ">=";
            case "LTE" -> "<=";
            case "EQUALS" -> "=";
            default -> null;
        };
    }

    private static String escape(Object value) {
        return value == null ? "" : HtmlUtils.htmlEscape(String.valueOf(value));
    }

    @SuppressWarnings("unchecked")
    private static Map<String, Object> asMap(Object value) {
        return value instanceof Map<?, ?> map ? (Map<String, Object>) map : Map.of();
    }

    private static List<String> stringList(Object value) {
        List<String> result = new ArrayList<>();
        if (value instanceof Collection<?> items) {
            for (Object item : items) {
                if (item != null) {
                    result.add(String.valueOf(item));
                }
            }
        }
        return result;
    }
}
