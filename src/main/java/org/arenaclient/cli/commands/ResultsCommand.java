package org.arenaclient.cli.commands;

import java.io.PrintWriter;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;

import org.arenaclient.cli.CommandLineInterface;
import org.arenaclient.match.api.results.ResultLogException;
import org.arenaclient.match.api.results.ResultRecord;
import org.arenaclient.match.resources.results.H2ResultLog;

import com.google.gson.GsonBuilder;
import com.typesafe.config.Config;

import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.ParentCommand;
import picocli.CommandLine.Spec;

/**
 * Prints the most recent rows of the result log.
 */
@Command(
    name = "results",
    description = "Show recently completed matches from the result log"
)
public class ResultsCommand implements Callable<Integer> {

    static final String RESULTS_OPTIONS = "node.processes.match-coordinator.options.results";

    @Option(names = {"--limit"}, defaultValue = "20", description = "Number of rows to show (default: ${DEFAULT-VALUE})")
    private int limit;

    @Option(names = {"--json"}, description = "Print rows as a JSON array")
    private boolean json;

    @ParentCommand
    private CommandLineInterface parent;

    @Spec
    private CommandSpec spec;

    @Override
    public Integer call() {
        final PrintWriter out = spec.commandLine().getOut();
        final PrintWriter err = spec.commandLine().getErr();
        if (limit < 1) {
            err.println("Error: --limit must be at least 1");
            return 1;
        }
        final Config config = parent.getConfig();
        if (!config.hasPath(RESULTS_OPTIONS)) {
            err.println("Error: no result log configured at " + RESULTS_OPTIONS);
            return 1;
        }

        final List<ResultRecord> rows;
        try (H2ResultLog resultLog = new H2ResultLog("results-cli", config.getConfig(RESULTS_OPTIONS))) {
            rows = resultLog.recent(limit);
        } catch (ResultLogException e) {
            err.println("Error: " + e.getMessage());
            return 1;
        }

        if (json) {
            out.println(new GsonBuilder().setPrettyPrinting().create().toJson(toMaps(rows)));
        } else {
            printTable(out, rows);
        }
        out.flush();
        return 0;
    }

    private static void printTable(final PrintWriter out, final List<ResultRecord> rows) {
        if (rows.isEmpty()) {
            out.println("No matches recorded.");
            return;
        }
        out.printf("%-24s %-20s %-16s %-16s %-8s %-26s %8s %5s%n",
            "RECORDED", "MATCH", "PLAYER 1", "PLAYER 2", "OUTCOME", "REASON", "STEPS", "STR");
        for (ResultRecord row : rows) {
            out.printf("%-24s %-20s %-16s %-16s %-8s %-26s %8d %2d/%-2d%n",
                row.recordedAt(), row.matchId(), row.player1(), row.player2(), row.outcome(),
                row.reason(), row.steps(), row.player1Strikes(), row.player2Strikes());
        }
    }

    static List<Map<String, Object>> toMaps(final List<ResultRecord> rows) {
        final List<Map<String, Object>> maps = new ArrayList<>();
        for (ResultRecord row : rows) {
            final Map<String, Object> map = new LinkedHashMap<>();
            map.put("recordedAt", row.recordedAt().toString());
            map.put("matchId", row.matchId());
            map.put("map", row.mapName());
            map.put("player1", row.player1());
            map.put("player2", row.player2());
            map.put("outcome", row.outcome());
            map.put("reason", row.reason());
            map.put("loser", row.loser());
            map.put("steps", row.steps());
            map.put("durationMs", row.durationMs());
            map.put("player1Strikes", row.player1Strikes());
            map.put("player2Strikes", row.player2Strikes());
            map.put("replayPath", row.replayPath());
            maps.add(map);
        }
        return maps;
    }
}
