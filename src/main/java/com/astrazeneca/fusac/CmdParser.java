package com.astrazeneca.fusac;

import com.astrazeneca.fusac.data.FfpeScope;
import com.astrazeneca.fusac.data.UmiPosition;
import htsjdk.samtools.ValidationStringency;
import org.apache.commons.cli.*;

import java.util.Iterator;
import java.util.List;

/**
 * Class to parse the parameters from the command line
 */
public class CmdParser {
    /**
     * Parses the array of command line parameters and fills configuration parameters.
     * @param args arguments from command line to be parsed
     * @return configuration with parameters from command line
     * @throws ParseException if parse can't be finished
     */
    public Configuration parseParams(String[] args) throws ParseException {
        Options options = buildOptions();

        CommandLineParser parser = new BasicParser();

        Configuration config = null;

        try {
            CommandLine cmd = parser.parse(options, args);
            if (cmd.getOptions().length == 0 || cmd.hasOption("H")) {
                help(options);
            }
            config = parseCmd(cmd);
        } catch (MissingOptionException e) {
            List<?> missingOptions = e.getMissingOptions();
            System.err.print("Missing required option(s): ");
            for (Iterator<?> iterator = missingOptions.iterator(); iterator.hasNext(); ) {
                Object object = iterator.next();
                System.err.print(object);
                if (iterator.hasNext()) {
                    System.err.print(", ");
                }
            }
            System.err.println();
            help(options);
        }

        return config;
    }

    /**
     * For each parameter in CMD set the Configuration variable
     * @param cmd parsed CommandLine from apache CLI
     * @return configuration with parameters from command line
     * @throws ParseException if values of options are wrong
     */
    Configuration parseCmd(CommandLine cmd) throws ParseException {
        Configuration config = new Configuration();

        config.bam = cmd.getOptionValue("b");
        config.vcf = cmd.getOptionValue("v");
        config.output = cmd.getOptionValue("o", Configuration.DEFAULT_OUTPUT);
        config.threads = Math.max(getIntValue(cmd, "t", 1), 1);
        config.queueSize = Math.max(getIntValue(cmd, "qs", 10), 1);
        config.debug = cmd.hasOption("D");
        config.samfilter = cmd.getOptionValue("F", "0x0");

        String ffpeNucleotides = cmd.getOptionValue("fn", "standard");
        switch (ffpeNucleotides.toLowerCase()) {
            case "all": config.ffpeScope = FfpeScope.ALL; break;
            case "standard": config.ffpeScope = FfpeScope.STANDARD; break;
            default: throw new ParseException("Unknown value of -fn option: " + ffpeNucleotides
                    + ". Use \"standard\" or \"all\".");
        }

        String umiPosition = cmd.getOptionValue("up", "qrn");
        switch (umiPosition.toLowerCase()) {
            case "qrn": config.umiPosition = UmiPosition.QNAME; break;
            case "rx": config.umiPosition = UmiPosition.RX; break;
            default: throw new ParseException("Unknown value of -up option: " + umiPosition
                    + ". Use \"qrn\" or \"rx\".");
        }

        config.qnameSplitCharacter = cmd.getOptionValue("qsc", "_");
        if (cmd.hasOption("usc")) {
            config.umiSplitCharacter = cmd.getOptionValue("usc", "");
        } else {
            // RX tag keeps the barcodes together, split it in half
            config.umiSplitCharacter = config.umiPosition == UmiPosition.RX ? "" : "+";
        }

        config.csvFile = !"no".equalsIgnoreCase(cmd.getOptionValue("cf", "yes"));
        if (cmd.hasOption("pe")) {
            String[] range = cmd.getOptionValues("pe");
            if (range.length != 2) {
                throw new ParseException("Option -pe needs two integer values: MIN MAX");
            }
            try {
                config.percentageMin = Integer.parseInt(range[0]);
                config.percentageMax = Integer.parseInt(range[1]);
            } catch (NumberFormatException e) {
                throw new ParseException("Option -pe needs two integer values: MIN MAX, got " + range[0] + " " + range[1]);
            }
        }

        if (cmd.hasOption("VS")) {
            config.validationStringency = ValidationStringency.valueOf(cmd.getOptionValue("VS").toUpperCase());
        }
        return config;
    }

    /**
     * Help information about options contains long and short option names and their descriptions
     * @return options from apache CLI
     */
    @SuppressWarnings("static-access")
    Options buildOptions() {
        Options options = new Options();
        options.addOption("H", "help", false, "Print this help page");
        options.addOption("D", "debug", false, "Debug mode. Will print stack traces of the exceptions skipped during the run.");

        options.addOption(OptionBuilder.withArgName("string")
                .hasArg(true)
                .withDescription("Input BAM file, must be indexed (Required)")
                .withType(String.class)
                .isRequired(true)
                .withLongOpt("inputBAM")
                .create('b'));

        options.addOption(OptionBuilder.withArgName("string")
                .hasArg(true)
                .withDescription("Input VCF file (Required)")
                .withType(String.class)
                .isRequired(true)
                .withLongOpt("inputVCF")
                .create('v'));

        options.addOption(OptionBuilder.withArgName("string")
                .hasArg(true)
                .withDescription("Output VCF file. Default: " + Configuration.DEFAULT_OUTPUT)
                .withType(String.class)
                .isRequired(false)
                .withLongOpt("output")
                .create('o'));

        options.addOption(OptionBuilder.withArgName("INT")
                .hasArg(true)
                .withDescription("No. threads to run the program. Default: 1")
                .withType(Number.class)
                .isRequired(false)
                .withLongOpt("threads")
                .create('t'));

        options.addOption(OptionBuilder.withArgName("INT")
                .hasArg(true)
                .withDescription("Capacity of the queue of records waiting to be written. Default: 10")
                .withType(Number.class)
                .isRequired(false)
                .withLongOpt("queueSize")
                .create("qs"));

        options.addOption(OptionBuilder.withArgName("standard/all")
                .hasArg(true)
                .withDescription("Choose \"all\" to include all base transitions in the analysis. Default: standard (C:G>T:A)")
                .withType(String.class)
                .isRequired(false)
                .withLongOpt("ffpeNucleotides")
                .create("fn"));

        options.addOption(OptionBuilder.withArgName("qrn/rx")
                .hasArg(true)
                .withDescription("UMI position: query name (qrn) or RX tag (rx). Default: qrn")
                .withType(String.class)
                .isRequired(false)
                .withLongOpt("umiPosition")
                .create("up"));

        options.addOption(OptionBuilder.withArgName("char")
                .hasArg(true)
                .withDescription("Character separating UMI from the query name. Default: _")
                .withType(String.class)
                .isRequired(false)
                .withLongOpt("QrnSplitCharacter")
                .create("qsc"));

        options.addOption(OptionBuilder.withArgName("char")
                .hasOptionalArg()
                .withDescription("Split character for the UMI. Default: + (for rx: split in half). "
                        + "Use \"\" for splitting the UMI in half")
                .withType(String.class)
                .isRequired(false)
                .withLongOpt("UMISplitCharacter")
                .create("usc"));

        options.addOption(OptionBuilder.withArgName("yes/no")
                .hasArg(true)
                .withDescription("Generate an output CSV file with molecular support of reference and variant, "
                        + "number of FFPE calls and FFPE VAF for each variant record. Default: yes")
                .withType(String.class)
                .isRequired(false)
                .withLongOpt("csvFile")
                .create("cf"));

        options.addOption(OptionBuilder.withArgName("MIN MAX")
                .hasArgs(2)
                .withDescription("Export to CSV only records with FFPE VAF (percent) in the range. Default: 0 100")
                .isRequired(false)
                .withLongOpt("percentageExclude")
                .create("pe"));

        options.addOption(OptionBuilder.withArgName("bit")
                .hasArg(true)
                .withDescription("The hexical to filter reads. Default: 0x0 (all overlapping reads are used). "
                        + "Use -F 0x900 to skip secondary and supplementary alignments.")
                .withType(String.class)
                .isRequired(false)
                .create('F'));

        options.addOption(OptionBuilder.withArgName("STRICT | LENIENT | SILENT")
                .hasArg(true)
                .withDescription("How strict to be when reading a SAM or BAM:\n"
                        + "STRICT   - throw an exception if something looks wrong.\n"
                        + "LENIENT  - Emit warnings but keep going if possible.\n"
                        + "SILENT   - Like LENIENT, only don't emit warning messages.\n"
                        + "Default: LENIENT")
                .withType(String.class)
                .isRequired(false)
                .withLongOpt("validation-stringency")
                .create("VS"));

        return options;
    }

    private int getIntValue(CommandLine cmd, String option, int defaultValue) throws ParseException {
        Object value = cmd.getParsedOptionValue(option);
        return value == null ? defaultValue : ((Number) value).intValue();
    }

    private void help(Options options) {
        HelpFormatter formater = new HelpFormatter();
        formater.setOptionComparator(null);
        formater.printHelp(142, "fusac -b bam -v vcf [-o output] [-t threads] [-fn standard|all] [-up qrn|rx]",
                "FUSAC (FFPE-tissue UMI-based Sequence Artefact Classifier) classifies single nucleotide variant calls\n"
                        + "as mutations or FFPE artefacts. Reads overlapping each variant are grouped into original molecules\n"
                        + "by their UMIs; a variant seen on both strands of a molecule is a mutation, a variant seen on one\n"
                        + "strand only is an FFPE artefact. The output VCF gets UMI and SUMI format fields with molecular\n"
                        + "support and the FFPE filter.\nOptions:",
                options, "");

        System.exit(0);
    }
}
