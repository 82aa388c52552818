package com.astrazeneca.fusac;

import com.astrazeneca.fusac.data.FfpeScope;
import com.astrazeneca.fusac.data.UmiPosition;
import htsjdk.samtools.ValidationStringency;
import org.apache.commons.cli.BasicParser;
import org.apache.commons.cli.MissingOptionException;
import org.apache.commons.cli.ParseException;
import org.testng.annotations.DataProvider;
import org.testng.annotations.Test;

import static org.testng.Assert.*;

public class CmdParserTest {
    private final CmdParser cmdParser = new CmdParser();

    private Configuration parse(String... args) throws ParseException {
        return cmdParser.parseCmd(new BasicParser().parse(cmdParser.buildOptions(), args));
    }

    @Test
    public void defaults() throws ParseException {
        Configuration config = parse("-b", "sample.bam", "-v", "calls.vcf");

        assertEquals(config.bam, "sample.bam");
        assertEquals(config.vcf, "calls.vcf");
        assertEquals(config.output, "fusac_output.vcf");
        assertEquals(config.csvOutput(), "fusac_output.vcf.csv");
        assertEquals(config.threads, 1);
        assertEquals(config.queueSize, 10);
        assertEquals(config.ffpeScope, FfpeScope.STANDARD);
        assertEquals(config.umiPosition, UmiPosition.QNAME);
        assertEquals(config.qnameSplitCharacter, "_");
        assertEquals(config.umiSplitCharacter, "+");
        assertTrue(config.csvFile);
        assertEquals(config.percentageMin, 0);
        assertEquals(config.percentageMax, 100);
        assertEquals(config.samfilter, "0x0");
        assertEquals(config.validationStringency, ValidationStringency.LENIENT);
        assertFalse(config.debug);
    }

    @Test
    public void overrides() throws ParseException {
        Configuration config = parse("-b", "sample.bam", "-v", "calls.vcf", "-o", "out.vcf", "-t", "4",
                "-qs", "50", "-fn", "all", "-qsc", ":", "-usc", ".", "-cf", "no", "-pe", "10", "90",
                "-F", "0x900", "-VS", "strict", "-D");

        assertEquals(config.output, "out.vcf");
        assertEquals(config.threads, 4);
        assertEquals(config.queueSize, 50);
        assertEquals(config.ffpeScope, FfpeScope.ALL);
        assertEquals(config.qnameSplitCharacter, ":");
        assertEquals(config.umiSplitCharacter, ".");
        assertFalse(config.csvFile);
        assertEquals(config.percentageMin, 10);
        assertEquals(config.percentageMax, 90);
        assertEquals(config.samfilter, "0x900");
        assertEquals(config.validationStringency, ValidationStringency.STRICT);
        assertTrue(config.debug);
    }

    @Test
    public void rxTagIsSplitInHalfByDefault() throws ParseException {
        Configuration config = parse("-b", "sample.bam", "-v", "calls.vcf", "-up", "rx");

        assertEquals(config.umiPosition, UmiPosition.RX);
        assertEquals(config.umiSplitCharacter, "");
    }

    @Test
    public void emptyUmiSplitCharacterMeansSplitInHalf() throws ParseException {
        Configuration config = parse("-b", "sample.bam", "-v", "calls.vcf", "-usc");

        assertEquals(config.umiPosition, UmiPosition.QNAME);
        assertEquals(config.umiSplitCharacter, "");
    }

    @Test
    public void threadsAreAtLeastOne() throws ParseException {
        Configuration config = parse("-b", "sample.bam", "-v", "calls.vcf", "-t", "0", "-qs", "0");

        assertEquals(config.threads, 1);
        assertEquals(config.queueSize, 1);
    }

    @DataProvider(name = "wrongValues")
    public Object[][] wrongValues() {
        return new Object[][] {
                {"-fn", "some"},
                {"-up", "tag"},
                {"-pe", "low"},
        };
    }

    @Test(dataProvider = "wrongValues", expectedExceptions = ParseException.class)
    public void wrongValueIsRejected(String option, String value) throws ParseException {
        parse("-b", "sample.bam", "-v", "calls.vcf", option, value);
    }

    @Test(expectedExceptions = MissingOptionException.class)
    public void inputFilesAreRequired() throws ParseException {
        parse("-b", "sample.bam");
    }
}
