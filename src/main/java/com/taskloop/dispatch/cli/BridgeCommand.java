package com.taskloop.dispatch.cli;

import com.taskloop.core.model.LoopOutcome;
import com.taskloop.dispatch.bridge.BridgeServer;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;

import java.io.IOException;
import java.util.concurrent.Callable;

/**
 * CLI command: taskloop bridge
 * <p>
 * Serves the JSON-RPC control surface on stdin/stdout until stdin closes. Nothing else may
 * be printed to stdout while it runs.
 */
@Command(name = "bridge", mixinStandardHelpOptions = true,
        description = "Serve newline-delimited JSON-RPC on stdin/stdout")
@Component
public class BridgeCommand implements Callable<Integer> {

    private final BridgeServer bridgeServer;

    public BridgeCommand(BridgeServer bridgeServer) {
        this.bridgeServer = bridgeServer;
    }

    @Override
    public Integer call() {
        try {
            bridgeServer.serve(System.in, System.out);
            return LoopOutcome.EXIT_COMPLETE;
        } catch (IOException | RuntimeException e) {
            System.err.println("Bridge failed: " + CliFailures.describe(e));
            return LoopOutcome.EXIT_FAILURE;
        }
    }
}
