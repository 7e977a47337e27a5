// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.opbatch.batcher;

import sh.opbatch.batcher.cli.OpBatchCommand;

public final class Main {
    private Main() {
    }

    public static void main(String[] args) {
        int code = OpBatchCommand.commandLine(new OpBatchCommand()).execute(args);
        System.exit(code);
    }
}
