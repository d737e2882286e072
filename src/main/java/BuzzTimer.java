import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Scanner;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;
import buzztimer.EngineObserver;
import buzztimer.HapticAction;
import buzztimer.Interval;
import buzztimer.IntervalPolicy;
import buzztimer.IntervalSequence;
import buzztimer.StatusDisplay;
import buzztimer.StatusSnapshot;
import buzztimer.TimeFormat;
import buzztimer.TimerEngine;
import buzztimer.TimerEngineFactory;

public final class BuzzTimer {

    private static final String ANSI_GREEN = "\u001B[32m";
    private static final String ANSI_RED = "\u001B[31m";
    private static final String ANSI_RESET = "\u001B[0m";
    private static final String COMMAND_PROMPT = "buzztimer> ";
    private static final boolean VERBOSE =
            "true".equals(System.getProperties().getProperty("buzztimer.verbose", "false"));

    public static void main(String[] args) {
        final boolean ansi;
        try {
            ansi = isAnsiRequested(args);
        } catch (final IllegalArgumentException e) {
            System.err.println("Illegal argument. Try: java BuzzTimer [-ansi]");
            return;
        }

        final boolean isConsole = (System.console() != null);
        final Consumer<String> promptPrinter = (prompt) -> {
            if (!isConsole) {
                return;
            }
            System.out.print(prompt);
            System.out.flush();
        };

        final Consumer<String> notificationPrinter = msg -> {
            System.out.println("\n" + (ansi ? ANSI_GREEN : "") + msg + (ansi ? ANSI_RESET : ""));
            promptPrinter.accept(COMMAND_PROMPT);
            System.out.flush();
        };

        final Consumer<String> errorPrinter = msg -> {
            System.out.println((ansi ? ANSI_RED : "") + msg + (ansi ? ANSI_RESET : ""));
            System.out.flush();
        };

        final Session session = new Session();
        final TimerEngine engine = TimerEngineFactory.builder()
                .tickPeriod(Long.getLong("buzztimer.tick", 100L), TimeUnit.MILLISECONDS)
                .observer(consoleObserver(session, notificationPrinter))
                .hapticAction(consoleHaptic(isConsole))
                .statusDisplay(consoleStatusDisplay(notificationPrinter))
                .build();
        session.engine = engine;

        Runtime.getRuntime().addShutdownHook(new Thread() {
            @Override
            public void run() {
                engine.shutdown();
            }
        });

        promptPrinter.accept("Welcome to BuzzTimer. Type 'help' for help.\n");
        promptPrinter.accept(COMMAND_PROMPT);

        final Scanner scanner = new Scanner(System.in);
        try {
            while (scanner.hasNextLine()) {
                try {
                    if (!parseAndExecute(scanner.nextLine(), session)) {
                        break;
                    }
                } catch (final IntervalPolicy.Violation | RuntimeException e) {
                    errorPrinter.accept(e.getMessage());
                }
                promptPrinter.accept(COMMAND_PROMPT);
            }
        } finally {
            scanner.close();
        }
    }

    static final class Session {
        final List<Interval> intervals = new ArrayList<>();
        boolean circular = false;
        TimerEngine engine;

        IntervalSequence sequence() {
            return IntervalSequence.of(intervals, circular);
        }
    }

    private static final String INVALID_SYNTAX_MESSAGE = "Invalid syntax.";
    static boolean parseAndExecute(
            final String command,
            final Session session)
            throws IntervalPolicy.Violation {
        final String[] split = command.trim().split("\\s+");
        final TimerEngine engine = session.engine;
        switch (split[0]) {
            case "":
                return true;
            case "help":
                System.out.println(" 1. a <min> <sec> [<name>] ................... add interval");
                System.out.println(" 2. ls ....................................... list intervals");
                System.out.println(" 3. rm <n> ................................... remove interval");
                System.out.println(" 4. dup <n> .................................. duplicate interval");
                System.out.println(" 5. mv <n> <to> .............................. move interval");
                System.out.println(" 6. cl ....................................... clear all intervals");
                System.out.println(" 7. circ on|off .............................. repeat sequence");
                System.out.println(" 8. start .................................... start sequence");
                System.out.println(" 9. pause / resume ........................... pause or resume");
                System.out.println("10. stop / reset ............................. stop or reset");
                System.out.println("11. st ....................................... show status");
                System.out.println("12. bye ...................................... exit BuzzTimer");
                return true;
            case "a":
                if (split.length < 3) {
                    throw new RuntimeException(INVALID_SYNTAX_MESSAGE);
                }
                final String name = split.length > 3
                        ? String.join(" ", Arrays.copyOfRange(split, 3, split.length))
                        : null;
                session.intervals.add(IntervalPolicy.parse(split[1], split[2], name));
                return true;
            case "ls":
                listing(session).forEach(System.out::println);
                return true;
            case "rm":
                if (split.length != 2) {
                    throw new RuntimeException(INVALID_SYNTAX_MESSAGE);
                }
                session.intervals.remove(position(split[1], session));
                return true;
            case "dup":
                if (split.length != 2) {
                    throw new RuntimeException(INVALID_SYNTAX_MESSAGE);
                }
                final int original = position(split[1], session);
                session.intervals.add(original + 1, session.intervals.get(original));
                return true;
            case "mv":
                if (split.length != 3) {
                    throw new RuntimeException(INVALID_SYNTAX_MESSAGE);
                }
                final int from = position(split[1], session);
                final int to = position(split[2], session);
                session.intervals.add(to, session.intervals.remove(from));
                return true;
            case "cl":
                session.intervals.clear();
                return true;
            case "circ":
                if (split.length != 2 || !("on".equals(split[1]) || "off".equals(split[1]))) {
                    throw new RuntimeException(INVALID_SYNTAX_MESSAGE);
                }
                session.circular = "on".equals(split[1]);
                return true;
            case "start":
                if (session.intervals.isEmpty()) {
                    throw new RuntimeException("Please add at least one interval.");
                }
                if (engine.isRunning()) {
                    throw new RuntimeException("Timer is already running.");
                }
                engine.stop();
                engine.setSequence(session.sequence());
                engine.start();
                return true;
            case "pause":
                engine.pause();
                return true;
            case "resume":
                engine.resume();
                return true;
            case "stop":
                engine.stop();
                return true;
            case "reset":
                engine.reset();
                return true;
            case "st":
                System.out.println(String.format("%-10s %-20s %s lap %d",
                        engine.getStatus(),
                        engine.getCurrentInterval().map(Interval::displayString).orElse("-"),
                        TimeFormat.format(engine.getRemainingMillis()),
                        engine.getLapCount()));
                return true;
            case "bye":
                engine.shutdown();
                return false;
            default:
                throw new RuntimeException("Invalid command.");
        }
    }

    // The running sequence is a snapshot, so edits made since start() leave nothing to mark.
    static List<String> listing(final Session session) {
        final List<Interval> intervals = session.intervals;
        final boolean marked = session.engine.getSequence().getIntervals().equals(intervals);
        final List<String> lines = new ArrayList<>();
        for (int i = 0; i < intervals.size(); i++) {
            lines.add(String.format("%2d. %s%s",
                    i + 1,
                    intervals.get(i).displayString(),
                    marked && i == session.engine.getCurrentIndex() ? " <" : ""));
        }
        lines.add(String.format("total %s %s",
                TimeFormat.format(session.sequence().totalMillis()),
                session.circular ? "(circular)" : "(once)"));
        return lines;
    }

    private static int position(final String argument, final Session session) {
        final int position;
        try {
            position = Integer.parseInt(argument);
        } catch (final NumberFormatException e) {
            throw new RuntimeException(INVALID_SYNTAX_MESSAGE);
        }
        if (position < 1 || position > session.intervals.size()) {
            throw new RuntimeException("No such interval.");
        }
        return position - 1;
    }

    private static EngineObserver consoleObserver(
            final Session session, final Consumer<String> notificationPrinter) {
        return new EngineObserver() {
            @Override
            public void onIntervalComplete(final int index) {
                notificationPrinter.accept(String.format("interval %d complete", index + 1));
            }
            @Override
            public void onSequenceComplete() {
                notificationPrinter.accept("Timer sequence completed!");
            }
            @Override
            public void onLapCountChanged(final int lapCount) {
                if (lapCount > 0) {
                    notificationPrinter.accept(String.format("lap %d", lapCount));
                }
            }
            @Override
            public void onCurrentIntervalChanged(final int index) {
                final IntervalSequence sequence = session.engine.getSequence();
                if (index < 0 || index >= sequence.size()) {
                    return;
                }
                notificationPrinter.accept(
                        String.format("now: %s", sequence.get(index).displayString()));
            }
            @Override
            public void onPaused() {
                notificationPrinter.accept("paused");
            }
            @Override
            public void onResumed() {
                notificationPrinter.accept("resumed");
            }
            @Override
            public void onStopped() {
                notificationPrinter.accept("stopped");
            }
        };
    }

    private static HapticAction consoleHaptic(final boolean isConsole) {
        return () -> {
            if (isConsole) {
                System.out.print('\u0007');
                System.out.flush();
            }
        };
    }

    // One may want to turn verbose off (a status line every second)
    private static StatusDisplay consoleStatusDisplay(final Consumer<String> notificationPrinter) {
        return new StatusDisplay() {
            @Override
            public void refresh(final StatusSnapshot snapshot, final boolean forced) {
                if (VERBOSE) {
                    notificationPrinter.accept(snapshot.toString());
                }
            }
            @Override
            public void clear() {}
        };
    }

    private static boolean isAnsiRequested(final String[] args) throws IllegalArgumentException {
        if (args.length == 0) {
            return false;
        }
        if ("-ansi".equals(args[0])) {
            return true;
        }
        throw new IllegalArgumentException();
    }
}
