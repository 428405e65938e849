package vn.com.fecredit.chunkeddownload.client;

import java.io.PrintStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Command line entry point: downloads one content object into a file.
 */
public class ClientApp {

    static final String[] REQUIRED = {"id", "gatewayUrl", "output"};

    public static void main(String[] args) {
        int status = run(args, System.out, System.err);
        if (status != 0) {
            System.exit(status);
        }
    }

    /**
     * @return process exit status, 0 on success
     */
    static int run(String[] args, PrintStream out, PrintStream err) {
        if (args.length == 0 || (args.length == 1 && args[0].equalsIgnoreCase("--help"))) {
            printHelp(out);
            return 0;
        }

        Map<String, String> params = parseArgs(args);
        List<String> problems = validate(params);
        if (!problems.isEmpty()) {
            problems.forEach(problem -> err.println("Error: " + problem));
            printHelp(err);
            return 2;
        }

        String id = params.get("id");
        Path output = Paths.get(params.get("output"));
        int concurrency = Integer.parseInt(params.getOrDefault("concurrency", "10"));
        try {
            ChunkedDownloadClient client = new ChunkedDownloadClient.Builder()
                    .gatewayUrl(params.get("gatewayUrl"))
                    .concurrency(concurrency)
                    .build();

            out.println("Downloading " + id + " to " + output);
            long written = client.downloadToFile(id, output, client.getConcurrency());
            out.println("Done: " + written + " bytes written to " + output);
            return 0;
        } catch (Exception e) {
            err.println("Download of " + id + " failed: " + e.getMessage());
            if (e.getCause() != null) {
                err.println("Cause: " + e.getCause().getMessage());
            }
            return 1;
        }
    }

    static Map<String, String> parseArgs(String[] args) {
        Map<String, String> params = new LinkedHashMap<>();
        for (String arg : args) {
            if (arg.startsWith("--")) {
                String[] parts = arg.substring(2).split("=", 2);
                if (parts.length == 2 && !parts[1].isBlank()) {
                    params.put(parts[0], parts[1].trim());
                }
            }
        }
        return params;
    }

    static List<String> validate(Map<String, String> params) {
        List<String> problems = new ArrayList<>();
        for (String key : REQUIRED) {
            if (!params.containsKey(key)) {
                problems.add("--" + key + " is required");
            }
        }
        String url = params.get("gatewayUrl");
        if (url != null && !url.startsWith("http://") && !url.startsWith("https://")) {
            problems.add("--gatewayUrl must be an http(s) URL: " + url);
        }
        String concurrency = params.get("concurrency");
        if (concurrency != null) {
            try {
                if (Integer.parseInt(concurrency) < 1) {
                    problems.add("--concurrency must be positive: " + concurrency);
                }
            } catch (NumberFormatException e) {
                problems.add("--concurrency is not a number: " + concurrency);
            }
        }
        String output = params.get("output");
        if (output != null && Files.isDirectory(Paths.get(output))) {
            problems.add("--output is a directory: " + output);
        }
        return problems;
    }

    private static void printHelp(PrintStream out) {
        out.println("Usage: java -jar chunked-download-client.jar --id=<id> --gatewayUrl=<url> --output=<path> [--concurrency=<n>]");
        out.println("  --id            content identifier");
        out.println("  --gatewayUrl    gateway base URL, e.g. https://gateway.example");
        out.println("  --output        file to write; replaced if it exists");
        out.println("  --concurrency   parallel chunk requests (default 10)");
    }
}
