package com.pipeline.lineage.tracer.output;

import java.io.IOException;
import java.io.StringWriter;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.pipeline.lineage.tracer.model.LineagePath;
import com.pipeline.lineage.tracer.model.TargetLineage;
import com.pipeline.lineage.util.FileWriteUtil;

import freemarker.template.Configuration;
import freemarker.template.Template;
import freemarker.template.TemplateException;
import freemarker.template.TemplateExceptionHandler;

/**
 * Renders a Markdown documentation page for a tracing run from {@code lineage-report.md.ftl}.
 */
public class LineageMarkdownReportWriter {
    private static final Logger log = LoggerFactory.getLogger(LineageMarkdownReportWriter.class);

    static final String TEMPLATE = "lineage-report.md.ftl";

    private final Configuration freemarkerConfig;

    public LineageMarkdownReportWriter() {
        this.freemarkerConfig = createFreemarkerConfig();
    }

    private Configuration createFreemarkerConfig() {
        Configuration cfg = new Configuration(Configuration.VERSION_2_3_32);
        cfg.setClassForTemplateLoading(getClass(), "/templates");
        cfg.setDefaultEncoding("UTF-8");
        cfg.setTemplateExceptionHandler(TemplateExceptionHandler.RETHROW_HANDLER);
        cfg.setLogTemplateExceptions(false);
        cfg.setWrapUncheckedExceptions(true);
        return cfg;
    }

    public void write(Path corpusRoot, List<TargetLineage> lineages, Path out) throws IOException {
        FileWriteUtil.safeWriteString(out, render(corpusRoot, lineages));
        log.info("Wrote lineage report for {} target(s) to {}", lineages.size(), out);
    }

    /**
     * @throws IOException if the template is missing or fails to render
     */
    public String render(Path corpusRoot, List<TargetLineage> lineages) throws IOException {
        Map<String, Object> model = new HashMap<>();
        model.put("corpusRoot", corpusRoot.toString());
        model.put("targets", toModel(lineages));

        Template template = freemarkerConfig.getTemplate(TEMPLATE);
        StringWriter out = new StringWriter();
        try {
            template.process(model, out);
        } catch (TemplateException e) {
            throw new IOException("Failed to render " + TEMPLATE, e);
        }
        return out.toString();
    }

    private static List<Map<String, Object>> toModel(List<TargetLineage> lineages) {
        List<Map<String, Object>> targets = new ArrayList<>(lineages.size());
        for (TargetLineage lineage : lineages) {
            Map<String, Object> target = new LinkedHashMap<>();
            target.put("name", lineage.getTarget().getCanonical());
            target.put("pathCount", lineage.pathCount());
            target.put("truncated", lineage.isTruncated());
            target.put("truncationReason", lineage.getTruncationReason() == null ? "" : lineage.getTruncationReason());
            target.put("cyclesCut", lineage.getCyclesCut());
            target.put("chains", lineage.getPaths().stream().map(LineagePath::toString).toList());
            targets.add(target);
        }
        return targets;
    }
}
