package com.umitunal;

import com.umitunal.examples.*;

/**
 * Main class that runs all UniQueue examples.
 */
public class Main {
    public static void main(String[] args) throws Exception {
        System.out.println("=== UniQueue Examples ===\n");

        BasicExample.main(args);
        RetryExample.main(args);
        ScheduledJobsExample.main(args);
        FairnessExample.main(args);
        CancellationExample.main(args);
        RecoveryExample.main(args);
        JsonExample.main(args);
        KryoExample.main(args);

        System.out.println("\n=== All Examples Complete ===");
    }
}
