package com.visprog.tools;

import com.visprog.blueprint.AnalysisReport;
import com.visprog.blueprint.BlueprintAnalyzer;
import com.visprog.blueprint.config.AnalysisConfig;
import com.visprog.blueprint.io.BlueprintJson;
import com.visprog.blueprint.io.GraphSnapshotLoader;
import com.visprog.blueprint.model.BlueprintSnapshot;
import com.visprog.blueprint.registry.NodeTypeRegistry;
import com.visprog.blueprint.registry.NodeTypeRegistryLoader;
import com.visprog.common.IEnvGetter;
import com.visprog.common.codec.Codec;
import com.visprog.common.errorsor.ErrorsOr;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.PrintStream;
import java.nio.file.Path;

/**
 * {@code BlueprintCheckApp <snapshot.json>}: validates a saved editor snapshot and prints the
 * report as JSON. Exit code 0 when the graph is valid, 1 when it has errors, 2 when it cannot be read.
 * Only the report goes to stdout; usage and load errors go to stderr.
 */
public class BlueprintCheckApp {
    private static final Logger log = LoggerFactory.getLogger(BlueprintCheckApp.class);

    static final int EXIT_OK = 0;
    static final int EXIT_INVALID = 1;
    static final int EXIT_UNREADABLE = 2;

    private static final Codec<AnalysisReport, String> REPORT_CODEC =
            Codec.clazzCodec(BlueprintJson.report(), AnalysisReport.class);

    public static void main(String[] args) {
        System.exit(run(args, System.out, System.err, IEnvGetter.env));
    }

    static int run(String[] args, PrintStream out, PrintStream err, IEnvGetter env) {
        if (args.length != 1) {
            err.println("Usage: BlueprintCheckApp <snapshot.json>");
            return EXIT_UNREADABLE;
        }
        AnalysisConfig config = AnalysisConfig.fromEnv(env);
        NodeTypeRegistry registry = NodeTypeRegistryLoader.fromClasspath(config.nodeTypesResource());
        BlueprintAnalyzer analyzer = BlueprintAnalyzer.fromConfig(config);

        Path file = Path.of(args[0]);
        ErrorsOr<BlueprintSnapshot> snapshot = new GraphSnapshotLoader(registry).fromJson(file);
        if (snapshot.isError()) {
            snapshot.getErrors().forEach(err::println);
            return EXIT_UNREADABLE;
        }

        AnalysisReport report = analyzer.analyze(snapshot.valueOrThrow());
        ErrorsOr<String> json = REPORT_CODEC.encode(report);
        if (json.isError()) {
            json.getErrors().forEach(err::println);
            return EXIT_UNREADABLE;
        }
        out.println(json.valueOrThrow());
        log.info("Checked {}: ok={} errors={} warnings={} variables={}", file.getFileName(),
                report.ok(), report.validation().errors().size(), report.validation().warnings().size(),
                report.variables().size());
        return report.ok() ? EXIT_OK : EXIT_INVALID;
    }
}
