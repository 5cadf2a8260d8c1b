package com.eda.defparser;

import com.eda.defparser.cli.ParseCommand;
import picocli.CommandLine;

/**
 * Main entry point for the DEF netlist parser.
 * Reads a DEF file and reports its components, placements and net connectivity.
 */
public class DefParserApplication {

    public static void main(String[] args) {
        int exitCode = new CommandLine(new ParseCommand())
                .setCaseInsensitiveEnumValuesAllowed(true)
                .execute(args);
        System.exit(exitCode);
    }
}
