package org.genebuild.genemerge.utils.config;

import com.google.common.collect.ImmutableMap;
import htsjdk.samtools.util.Log;
import org.genebuild.genemerge.testutils.BaseTest;
import org.testng.Assert;
import org.testng.annotations.Test;

import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;

public final class ConfigFactoryUnitTest extends BaseTest {

    @Test
    public void testDefaults() {
        final GeneMergeConfig config = ConfigFactory.getInstance().getGeneMergeConfig();
        Assert.assertEquals(config.manualLogicName(), "havana");
        Assert.assertEquals(config.mergedGeneLogicName(), "ensembl_havana_gene");
        Assert.assertEquals(config.mergedTranscriptLogicName(), "ensembl_havana_transcript");
        Assert.assertEquals(config.manualBiotypeSuffix(), "_havana");
        Assert.assertEquals(config.demotedTranscriptSuffix(), "_e");
        Assert.assertEquals(config.mergedTranscriptSuffix(), "_m");
        Assert.assertEquals(config.mergedGeneSuffix(), "_m");
        Assert.assertEquals(config.manualGeneSuffix(), "_h");
        Assert.assertEquals(config.automaticGeneSuffix(), "_e");
        Assert.assertEquals(config.pseudogeneAbsorptionThreshold(), 10.0);
        Assert.assertEquals(config.manualProcessedBiotypes(),
                Arrays.asList("processed_transcript", "retained_intron", "non_coding"));
        Assert.assertEquals(config.automaticCodingBiotypes(), Collections.singletonList("protein_coding"));
    }

    @Test
    public void testGetOrCreateIsCached() {
        Assert.assertSame(ConfigFactory.getInstance().getGeneMergeConfig(), ConfigFactory.getInstance().getGeneMergeConfig());
    }

    @Test
    public void testCreateWithOverrides() {
        final GeneMergeConfig config = ConfigFactory.getInstance().create(GeneMergeConfig.class,
                ImmutableMap.of("pseudogene.absorption.threshold", "25.5",
                                "manual.pseudo.biotypes", "polymorphic_pseudogene"));
        Assert.assertEquals(config.pseudogeneAbsorptionThreshold(), 25.5);
        Assert.assertEquals(config.manualPseudoBiotypes(), Collections.singletonList("polymorphic_pseudogene"));
        // untouched keys keep their defaults
        Assert.assertEquals(config.manualLogicName(), "havana");
        Assert.assertNotSame(config, ConfigFactory.getInstance().getGeneMergeConfig());
    }

    @Test
    public void testGetSourcesAnnotationPathVariables() {
        final List<String> variables =
                ConfigFactory.getInstance().getSourcesAnnotationPathVariables(GeneMergeConfig.class);
        Assert.assertEquals(variables, Arrays.asList(GeneMergeConfig.CONFIG_FILE_VARIABLE_FILE_NAME,
                GeneMergeConfig.CONFIG_FILE_VARIABLE_CLASS_PATH));
    }

    @Test
    public void testUnsetPathVariableIsDefaulted() {
        final String property = "ConfigFactoryUnitTest.unsetPathVariable";
        ConfigFactory.getInstance().checkFileNamePropertyExistenceAndSetConfigFactoryProperties(
                Collections.singletonList(property));
        Assert.assertEquals(org.aeonbits.owner.ConfigFactory.getProperty(property), ConfigFactory.NO_PATH_VARIABLE_VALUE);
    }

    @Test
    public void testGetConfigMap() {
        final GeneMergeConfig config = ConfigFactory.getInstance().getGeneMergeConfig();
        final LinkedHashMap<String, Object> configMap = ConfigFactory.getConfigMap(config);
        Assert.assertEquals(configMap.get("manual.logic.name"), "havana");
        Assert.assertEquals(configMap.get("pseudogene.absorption.threshold"), 10.0);
        Assert.assertTrue(configMap.containsKey("demoted.transcript.suffix"));

        // must not throw at any level
        ConfigFactory.logConfigFields(config, Log.LogLevel.INFO);
        ConfigFactory.logConfigFields(config);
    }
}
