package org.genebuild.genemerge.tools.merge;

import org.genebuild.genemerge.utils.SimpleInterval;
import org.genebuild.genemerge.utils.genemodel.Gene;

import java.util.List;

/**
 * Read access to one annotation.
 */
@FunctionalInterface
public interface GeneSource {

    /**
     * @return every gene of the given biotype overlapping {@code region}, with transcripts, translations, exons
     * and supporting evidence populated
     */
    List<Gene> fetchGenesByType(final SimpleInterval region, final String biotype);
}
