package org.genebuild.genemerge.utils.config;

import org.aeonbits.owner.Accessible;
import org.aeonbits.owner.Config.LoadPolicy;
import org.aeonbits.owner.Config.LoadType;
import org.aeonbits.owner.Config.Sources;

import java.util.List;

/**
 * Configuration file for the gene merge.
 * All specified {@code Sources} will be loaded.
 * The {@link LoadPolicy} is set to {@link LoadType#MERGE}, which specifies that if a configuration option is not found
 * in the first source, the option will be sought in all following sources until a definition is found.
 * If the option is not specified in any file, the coded default value will be used (as defined by @DefaultValue).
 *
 * The load order is always resolved "top-down" by declaration order in the @Sources annotation.
 *
 * In this case, the load order is:
 *        1)   "file:${" + GeneMergeConfig.CONFIG_FILE_VARIABLE_FILE_NAME + "}",
 *        2)   "classpath:${" + GeneMergeConfig.CONFIG_FILE_VARIABLE_CLASS_PATH + "}",
 *        3)   "file:GeneMergeConfig.properties",
 *        4)   "classpath:org/genebuild/genemerge/utils/config/GeneMergeConfig.properties"
 *        5)   hard-coded values specified by @DefaultValue
 *
 * "Manual" options describe the curated annotation source, "automatic" options the pipeline-predicted one.
 */
@LoadPolicy(LoadType.MERGE)
@Sources({
        "file:${" + GeneMergeConfig.CONFIG_FILE_VARIABLE_FILE_NAME + "}",                  // Variable for file loading
        "classpath:${" + GeneMergeConfig.CONFIG_FILE_VARIABLE_CLASS_PATH + "}",            // Variable for class path loading
        "file:GeneMergeConfig.properties",                                                 // Default path
        "classpath:org/genebuild/genemerge/utils/config/GeneMergeConfig.properties"        // Class path
})
public interface GeneMergeConfig extends Accessible {

    // =================================================================================================================
    // Meta Options:
    // =================================================================================================================

    /**
     * Name of the configuration file variable to be used in the {@link Sources} annotation for {@link GeneMergeConfig}
     * as a place to find the configuration file corresponding to this interface.
     */
    String CONFIG_FILE_VARIABLE_FILE_NAME = "GeneMergeConfig.pathToConfig";

    /**
     * Name of the configuration file variable to be used in the {@link Sources} annotation for {@link GeneMergeConfig}
     * as a place to find the configuration file corresponding to this interface.
     */
    String CONFIG_FILE_VARIABLE_CLASS_PATH = "GeneMergeConfig.classPathToConfig";

    // =================================================================================================================
    // Input gene types:
    // =================================================================================================================

    @Key("automatic.coding.biotypes")
    @DefaultValue("protein_coding")
    List<String> automaticCodingBiotypes();

    @Key("automatic.processed.biotypes")
    @DefaultValue("processed_transcript")
    List<String> automaticProcessedBiotypes();

    @Key("automatic.pseudo.biotypes")
    @DefaultValue("pseudogene")
    List<String> automaticPseudoBiotypes();

    @Key("manual.coding.biotypes")
    @DefaultValue("protein_coding")
    List<String> manualCodingBiotypes();

    @Key("manual.processed.biotypes")
    @DefaultValue("processed_transcript,retained_intron,non_coding")
    List<String> manualProcessedBiotypes();

    @Key("manual.pseudo.biotypes")
    @DefaultValue("pseudogene,processed_pseudogene,unprocessed_pseudogene")
    List<String> manualPseudoBiotypes();

    // =================================================================================================================
    // Output biotype decoration:
    // =================================================================================================================

    /** Appended to the biotype of every transcript coming from the manual source. */
    @Key("manual.biotype.suffix")
    @DefaultValue("_havana")
    String manualBiotypeSuffix();

    /** Appended to the biotype of an automatic coding transcript demoted to the biotype of a manual one. */
    @Key("demoted.transcript.suffix")
    @DefaultValue("_e")
    String demotedTranscriptSuffix();

    @Key("merged.transcript.suffix")
    @DefaultValue("_m")
    String mergedTranscriptSuffix();

    @Key("merged.gene.suffix")
    @DefaultValue("_m")
    String mergedGeneSuffix();

    @Key("manual.gene.suffix")
    @DefaultValue("_h")
    String manualGeneSuffix();

    @Key("automatic.gene.suffix")
    @DefaultValue("_e")
    String automaticGeneSuffix();

    // =================================================================================================================
    // Analysis logic names:
    // =================================================================================================================

    @Key("manual.logic.name")
    @DefaultValue("havana")
    String manualLogicName();

    @Key("merged.gene.logic.name")
    @DefaultValue("ensembl_havana_gene")
    String mergedGeneLogicName();

    @Key("merged.transcript.logic.name")
    @DefaultValue("ensembl_havana_transcript")
    String mergedTranscriptLogicName();

    // =================================================================================================================
    // Clustering:
    // =================================================================================================================

    /**
     * Percentage of the longest translation of a coding gene that one coding exon / pseudogene exon overlap
     * has to exceed for the pseudogene to be folded into that coding gene.
     */
    @Key("pseudogene.absorption.threshold")
    @DefaultValue("10.0")
    double pseudogeneAbsorptionThreshold();
}
