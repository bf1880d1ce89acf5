/*
 * Copyright © 2026 Aniruddh Panvelkar
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 *
 * Original Author: Aniruddh Panvelkar
 * Project: PostgreSQL Upgrade Precheck Tool
 */

package com.acme.pgprecheck;

import com.acme.pgprecheck.checks.PrecheckRunner;
import com.acme.pgprecheck.checks.RuleCatalog;
import com.acme.pgprecheck.config.PrecheckConfig;
import com.acme.pgprecheck.config.PrecheckConfigLoader;
import com.acme.pgprecheck.exceptions.ConnectivityException;
import com.acme.pgprecheck.exceptions.InputValidationException;
import com.acme.pgprecheck.model.PrecheckSession;
import com.acme.pgprecheck.probe.JdbcProbeClient;
import com.acme.pgprecheck.probe.ProbeClient;
import com.acme.pgprecheck.probe.ProbeClientFactory;
import com.acme.pgprecheck.prompt.ConsolePrompter;
import com.acme.pgprecheck.prompt.Prompter;
import com.acme.pgprecheck.report.JsonReportWriter;
import com.acme.pgprecheck.report.PrecheckReport;
import com.acme.pgprecheck.report.ReportRenderer;
import com.acme.pgprecheck.report.TextReportWriter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Path;
import java.util.Locale;

@CommandLine.Command(
        name = "pg-upgrade-precheck",
        mixinStandardHelpOptions = true,
        version = "1.0.0",
        description = "Read-only precheck of an Aurora/RDS PostgreSQL instance before a major version upgrade.",
        sortOptions = false
)
public class PgUpgradePrecheckApp implements java.util.concurrent.Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(PgUpgradePrecheckApp.class);

    static final String BLUE_GREEN_QUESTION = "Do you need Blue/Green deployment checks? (yes/no): ";

    @CommandLine.Parameters(index = "0", arity = "0..1", paramLabel = "HOST", description = "Instance or cluster endpoint.")
    private String host;

    @CommandLine.Parameters(index = "1", arity = "0..1", paramLabel = "PORT", description = "Port, 1-65535.")
    private String port;

    @CommandLine.Parameters(index = "2", arity = "0..1", paramLabel = "USER", description = "Database user.")
    private String user;

    @CommandLine.Parameters(index = "3", arity = "0..1", paramLabel = "TARGET_VERSION", description = "Target major version: 11-17.")
    private String targetVersion;

    private final Prompter prompter;
    private final ProbeClientFactory clients;
    private final PrecheckConfig config;
    private final RuleCatalog catalog;
    private final PrintStream out;
    private final PrintStream err;

    public PgUpgradePrecheckApp() {
        this(new ConsolePrompter(System.out), JdbcProbeClient::new, PrecheckConfigLoader.load(),
                RuleCatalog.defaultCatalog(), System.out, System.err);
    }

    PgUpgradePrecheckApp(Prompter prompter, ProbeClientFactory clients, PrecheckConfig config,
                         RuleCatalog catalog, PrintStream out, PrintStream err) {
        this.prompter = prompter;
        this.clients = clients;
        this.config = config;
        this.catalog = catalog;
        this.out = out;
        this.err = err;
    }

    public static void main(String[] args) {
        int exitCode = new CommandLine(new PgUpgradePrecheckApp()).execute(args);
        System.exit(exitCode);
    }

    @Override
    public Integer call() {
        try {
            PrecheckContext ctx = PrecheckContext.fromArgs(host, port, user, targetVersion);

            String password = prompter.readSecret("Enter PostgreSQL password: ");
            if (password == null) throw new InputValidationException("No password entered");
            out.println();

            ProbeClient client = clients.open(ctx, password, config);
            PrecheckRunner runner = new PrecheckRunner(client, catalog, config);
            int source = runner.detectSourceVersion();

            TextReportWriter text = new TextReportWriter(out);
            text.writeHeader(ctx, source);
            if (source >= ctx.targetVersion) {
                throw new InputValidationException("Source version (" + source + ") >= Target version (" + ctx.targetVersion
                        + "). This precheck is for upgrading TO version " + ctx.targetVersion + ".");
            }
            text.writeVersionCheckPassed(source, ctx.targetVersion);

            out.println();
            boolean blueGreen = askBlueGreen(prompter, out);
            text.writeStart();

            PrecheckSession session = runner.run(source, ctx.targetVersion, blueGreen);
            PrecheckReport report = new ReportRenderer(catalog).render(session);
            text.write(report);

            if (config.jsonReportEnabled()) {
                writeJson(ctx, report);
            }
            return ReportRenderer.exitStatus(session);
        } catch (InputValidationException | ConnectivityException e) {
            err.println("❌ ERROR: " + e.getMessage());
            return 1;
        } catch (IOException e) {
            err.println("❌ ERROR: Unable to read input: " + e.getMessage());
            return 1;
        }
    }

    private void writeJson(PrecheckContext ctx, PrecheckReport report) {
        try {
            Path file = JsonReportWriter.write(ctx, report, Path.of(config.reportDir()));
            out.println("Report: " + file);
        } catch (IOException e) {
            log.warn("Could not write JSON report to {}", config.reportDir(), e);
            err.println("⚠️ WARN: Could not write JSON report: " + e.getMessage());
        }
    }

    /** Re-asks until the answer is yes, y, no or n (any case). End of input is an error. */
    static boolean askBlueGreen(Prompter prompter, PrintStream out) throws IOException, InputValidationException {
        while (true) {
            String answer = prompter.readLine(BLUE_GREEN_QUESTION);
            if (answer == null) {
                throw new InputValidationException("No answer to the Blue/Green question (end of input)");
            }
            switch (answer.trim().toLowerCase(Locale.ROOT)) {
                case "yes":
                case "y":
                    return true;
                case "no":
                case "n":
                    return false;
                default:
                    out.println("Invalid input. Please enter 'yes' or 'no'.");
            }
        }
    }
}
