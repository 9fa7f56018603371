package org.endlesssource.streambridge.examples;

import org.endlesssource.streambridge.CacheKeys;
import org.endlesssource.streambridge.CatalogFacade;
import org.endlesssource.streambridge.StreamBridge;
import org.endlesssource.streambridge.api.Fetched;
import org.endlesssource.streambridge.api.Page;
import org.endlesssource.streambridge.api.Playable;
import org.endlesssource.streambridge.api.Rail;
import org.endlesssource.streambridge.api.StreamBridgeException;
import org.endlesssource.streambridge.api.VideoItem;
import org.endlesssource.streambridge.preflight.PreflightReport;

import java.util.List;
import java.util.Scanner;

public final class CatalogCliExample {
    private static final List<String> CLEARABLE = List.of(CacheKeys.HOME_PREFIX, CacheKeys.RAIL_PREFIX,
            CacheKeys.SEARCH_PREFIX, CacheKeys.PLAYABLE_PREFIX, CacheKeys.REGION);

    public static void main(String[] args) {
        try (ExampleHost host = ExampleHost.fromEnvironment();
             Scanner scanner = new Scanner(System.in)) {
            StreamBridge bridge = StreamBridge.create(host.platform(), host.cache());
            CatalogFacade content = bridge.content();
            System.out.println("Catalog CLI (extensions: " + host.extensionsDir() + ")");
            printHelp();

            String lastRail = null;
            String nextCursor = null;
            while (true) {
                System.out.print("catalog> ");
                if (!scanner.hasNextLine()) {
                    break;
                }

                String line = scanner.nextLine().trim();
                if (line.isEmpty()) {
                    continue;
                }

                String[] parts = line.split("\\s+", 2);
                String cmd = parts[0].toLowerCase();
                String arg = parts.length > 1 ? parts[1].trim() : "";

                try {
                    switch (cmd) {
                        case "help" -> printHelp();
                        case "quit", "exit" -> {
                            return;
                        }
                        case "backend" -> System.out.println("Backend: " + content.descriptor());
                        case "home" -> printRails(content.homeRails("refresh".equals(arg)));
                        case "rail" -> {
                            if (arg.isEmpty()) {
                                System.out.println("Usage: rail <id>");
                                continue;
                            }
                            Page page = printPage(content.rail(arg, null, bridge.getOptions().getHomeRailPageSize(), false));
                            lastRail = arg;
                            nextCursor = page.nextCursor();
                        }
                        case "more" -> {
                            if (lastRail == null || nextCursor == null) {
                                System.out.println("No further page.");
                                continue;
                            }
                            Page page = printPage(content.rail(lastRail, nextCursor,
                                    bridge.getOptions().getHomeRailPageSize(), false));
                            nextCursor = page.nextCursor();
                        }
                        case "search" -> {
                            if (arg.isEmpty()) {
                                System.out.println("Usage: search <query>");
                                continue;
                            }
                            printPage(content.search(arg, null, bridge.getOptions().getHomeRailPageSize(), false));
                        }
                        case "play" -> {
                            if (arg.isEmpty()) {
                                System.out.println("Usage: play <id>");
                                continue;
                            }
                            printPlayable(content.playable(arg, false));
                        }
                        case "region" -> System.out.println("Region: " + content.region().orElse("unknown"));
                        case "preflight" -> printPreflight(bridge.preflight().check());
                        case "clear" -> {
                            List<String> prefixes = arg.isEmpty() ? CLEARABLE : List.of(arg);
                            int removed = prefixes.stream().mapToInt(content::invalidate).sum();
                            System.out.println("Removed " + removed + " cached entries.");
                        }
                        default -> System.out.println("Unknown command: " + cmd + " (type 'help')");
                    }
                } catch (StreamBridgeException e) {
                    System.out.println(cmd + " failed: " + e.getMessage());
                }
            }
        } catch (Exception e) {
            System.err.println("Catalog CLI failed: " + e.getMessage());
        }
    }

    private static void printHelp() {
        System.out.println("Commands:");
        System.out.println("  help                Show this help");
        System.out.println("  backend             Show the selected backend");
        System.out.println("  home [refresh]      List home rails");
        System.out.println("  rail <id>           Show the first page of a rail");
        System.out.println("  more                Show the next page of the last rail");
        System.out.println("  search <query>      Search the catalog");
        System.out.println("  play <id>           Resolve a playable stream");
        System.out.println("  region              Show the marketplace region");
        System.out.println("  preflight           Check login, decryption component and DRM");
        System.out.println("  clear [prefix]      Drop cached responses");
        System.out.println("  exit                Quit");
    }

    private static void printRails(Fetched<List<Rail>> rails) {
        if (rails.value().isEmpty()) {
            System.out.println("No rails.");
            return;
        }
        for (Rail rail : rails.value()) {
            System.out.printf("  %-24s %s%n", rail.identifier(), rail.title());
        }
        System.out.println(source(rails));
    }

    private static Page printPage(Fetched<Page> fetched) {
        Page page = fetched.value();
        if (page.items().isEmpty()) {
            System.out.println("No items.");
        }
        for (VideoItem item : page.items()) {
            String year = item.year() == null ? "" : " (" + item.year() + ")";
            String kind = item.movie() ? "movie" : item.show() ? "show" : "item";
            System.out.printf("  %-14s %s%s [%s]%n", item.id(), item.title(), year, kind);
        }
        if (page.nextCursor() != null) {
            System.out.println("  ... more available");
        }
        System.out.println(source(fetched));
        return page;
    }

    private static void printPlayable(Fetched<Playable> fetched) {
        Playable playable = fetched.value();
        System.out.println("Stream:   " + playable.streamUrl() + " (" + playable.manifestType() + ")");
        System.out.println("License:  " + (playable.licenseKey() == null ? "none" : playable.licenseKey()));
        if (!playable.headers().isEmpty()) {
            System.out.println("Headers:  " + playable.headers().keySet());
        }
        System.out.println(source(fetched));
    }

    private static void printPreflight(PreflightReport report) {
        if (report.ready()) {
            System.out.println("Ready: " + report.backend());
            return;
        }
        report.failures().forEach(failure ->
                System.out.println("  " + failure.code() + ": " + failure.remediation()));
    }

    private static String source(Fetched<?> fetched) {
        return fetched.fromCache() ? "(cached)" : "(fresh)";
    }

    private CatalogCliExample() {
    }
}
