package com.colloquy.dispatch.cli;

import com.colloquy.core.credit.CostAccountant;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.util.concurrent.Callable;

/**
 * CLI command: colloquy credits &lt;user&gt;
 */
@Command(name = "credits", mixinStandardHelpOptions = true, description = "Show a user's credit balance and history")
@Component
public class CreditsCommand implements Callable<Integer> {

    @Parameters(index = "0", description = "User id")
    private String userId;

    @Option(names = {"--limit", "-l"}, defaultValue = "10", description = "Number of transactions to show")
    private int limit;

    private final CostAccountant accountant;

    public CreditsCommand(CostAccountant accountant) {
        this.accountant = accountant;
    }

    @Override
    public Integer call() {
        var stats = accountant.statistics(userId);
        if (stats.isEmpty()) {
            ConsoleOutput.error("No credit account for " + userId);
            return ExitCodes.REJECTED;
        }
        var s = stats.get();
        ConsoleOutput.info(String.format("%s: balance %d, used %d, added %d (%d transactions)",
                s.userId(), s.balance(), s.totalUsed(), s.totalAdded(), s.transactionCount()));
        for (var tx : accountant.history(userId, limit)) {
            System.out.printf("  %s  %-8s %+8d  -> %-8d %s%n",
                    tx.createdAt(), tx.type(), tx.amount(), tx.balanceAfter(), tx.reason());
        }
        return ExitCodes.OK;
    }
}
