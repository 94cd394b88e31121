package io.workline.cli;

import io.workline.core.pipeline.CallStart;
import io.workline.core.pipeline.TurnOutcome;
import java.io.BufferedReader;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.util.concurrent.Callable;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

/**
 * Text stand-in for the telephony adapter: each stdin line is one caller utterance.
 * Closing stdin before the interview finishes counts as a hang-up.
 */
@Command(name = "call", description = "Hold an interview over stdin/stdout")
public final class CallCommand implements Callable<Integer> {
    static final String HANG_UP_REASON = "caller_hung_up";

    private final CliContext context;

    @Option(names = {"--phone"}, required = true, description = "Caller phone number")
    String phone;

    @Option(names = {"--destination"}, description = "Webhook URL for the finished profile")
    String destination;

    public CallCommand(CliContext context) {
        this.context = context;
    }

    @Override
    public Integer call() {
        try {
            CallStart start = context.pipeline().startCall(phone, destination);
            if (!start.started()) {
                System.out.println("Rate limited: " + start.rateLimit().count() + " of " + start.rateLimit().limit()
                    + " calls used, next call allowed at " + start.rateLimit().resetAt());
                return 2;
            }
            System.out.println("Call " + start.callId());
            System.out.println("agent> " + start.openingPrompt());

            BufferedReader in = new BufferedReader(new InputStreamReader(System.in, StandardCharsets.UTF_8));
            String line;
            while ((line = in.readLine()) != null) {
                TurnOutcome outcome = context.pipeline().handleTurn(start.callId(), line);
                if (outcome.status() == TurnOutcome.Status.NOT_FOUND) {
                    System.out.println("Call session expired");
                    return 1;
                }
                if (outcome.status() == TurnOutcome.Status.ALREADY_FINISHED) {
                    break;
                }
                System.out.println("agent> " + outcome.message());
                if (!outcome.continueCall()) {
                    System.out.println("Call finished");
                    context.pipeline().session(start.callId()).ifPresent(session -> System.out.println(
                        "Profile completeness: " + Math.round(session.conversationState().completeness() * 100) + "%"));
                    return 0;
                }
            }
            context.pipeline().failCall(start.callId(), HANG_UP_REASON);
            System.out.println("Call ended before the interview finished");
            return 0;
        } catch (Exception e) {
            System.err.println("Call command failed: " + e.getMessage());
            return 1;
        }
    }
}
