package com.thriftgen.generator;

import com.thriftgen.generator.cli.CheckFragmentsCommand;
import picocli.CommandLine;

/**
 * Command-line entry point. Schema parsing happens upstream, so the tool's own
 * command is aimed at fragment authors: it compiles a fragment set and reports errors.
 */
public class GeneratorApplication {

    public static void main(String[] args) {
        int exitCode = new CommandLine(new CheckFragmentsCommand()).execute(args);
        System.exit(exitCode);
    }
}
