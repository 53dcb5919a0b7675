package com.pipeline.lineage.tracer.index;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.pipeline.lineage.tracer.corpus.SourceCorpus;
import com.pipeline.lineage.tracer.model.ScriptTarget;
import com.pipeline.lineage.tracer.model.TableName;
import com.pipeline.lineage.tracer.model.Writer;
import com.pipeline.lineage.tracer.model.WriterKind;

/**
 * Lists which Spark script or view definition produces which table.
 */
public class ScriptTargetMapper {
    private static final Logger log = LoggerFactory.getLogger(ScriptTargetMapper.class);

    /**
     * Mappings sorted by script path (relative to the corpus root), then target.
     */
    public List<ScriptTarget> map(SourceCorpus corpus, WriterIndex index) {
        List<ScriptTarget> mappings = new ArrayList<>();
        for (TableName table : index.tables()) {
            for (Writer writer : index.writers(table)) {
                if (writer.getKind() != WriterKind.SAS_PROGRAM) {
                    mappings.add(new ScriptTarget(corpus.relativize(writer.getScript()), table));
                }
            }
        }
        Collections.sort(mappings);
        log.info("Detected {} script to target mappings", mappings.size());
        return mappings;
    }
}
