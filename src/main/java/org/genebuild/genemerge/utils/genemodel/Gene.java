package org.genebuild.genemerge.utils.genemodel;

import htsjdk.samtools.util.Locatable;
import org.genebuild.genemerge.utils.Utils;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;

/**
 * A set of transcripts believed to come from one locus. Transcripts keep their insertion order, and the span of the
 * gene is the union of the spans of its transcripts.
 */
public final class Gene implements Locatable {

    private final String id;
    private final String logicName;
    private String biotype;
    private final List<Transcript> transcripts = new ArrayList<>();

    public Gene(final String id, final String biotype, final String logicName) {
        this.id = Utils.nonEmpty(id, "gene id");
        this.biotype = Utils.nonNull(biotype, "biotype");
        this.logicName = Utils.nonNull(logicName, "logicName");
    }

    /**
     * Creates a gene holding the given transcripts, as produced by clustering.
     */
    public Gene(final String id, final String biotype, final String logicName, final Collection<Transcript> transcripts) {
        this(id, biotype, logicName);
        Utils.nonNull(transcripts);
        transcripts.forEach(this::addTranscript);
    }

    public String getId() {
        return id;
    }

    public String getLogicName() {
        return logicName;
    }

    public String getBiotype() {
        return biotype;
    }

    public void setBiotype(final String biotype) {
        this.biotype = Utils.nonEmpty(biotype, "biotype");
    }

    public List<Transcript> getTranscripts() {
        return Collections.unmodifiableList(transcripts);
    }

    public boolean isEmpty() {
        return transcripts.isEmpty();
    }

    public void addTranscript(final Transcript transcript) {
        Utils.nonNull(transcript);
        Utils.validateArg(transcripts.stream().noneMatch(t -> t == transcript),
                () -> "transcript " + transcript.getId() + " is already part of gene " + id);
        transcripts.add(transcript);
    }

    /**
     * @return true if the transcript was part of this gene
     */
    public boolean removeTranscript(final Transcript transcript) {
        Utils.nonNull(transcript);
        return transcripts.removeIf(t -> t == transcript);
    }

    @Override
    public String getContig() {
        Utils.validate(!isEmpty(), () -> "gene " + id + " has no transcripts");
        return transcripts.get(0).getContig();
    }

    @Override
    public int getStart() {
        Utils.validate(!isEmpty(), () -> "gene " + id + " has no transcripts");
        return transcripts.stream().mapToInt(Transcript::getStart).min().getAsInt();
    }

    @Override
    public int getEnd() {
        Utils.validate(!isEmpty(), () -> "gene " + id + " has no transcripts");
        return transcripts.stream().mapToInt(Transcript::getEnd).max().getAsInt();
    }

    @Override
    public String toString() {
        return id + "(" + biotype + ", " + transcripts.size() + " transcripts)";
    }
}
