package com.voltquery.exception;

/**
 * Failure of a single scenario branch. Recorded in the branch report, never thrown to the caller.
 */
public class BranchException extends VoltQueryException {

    private final String branchName;

    public BranchException(String branchName, Throwable cause) {
        super("Scenario branch '" + branchName + "' failed: " + cause.getMessage(), cause);
        this.branchName = branchName;
    }

    public String getBranchName() {
        return branchName;
    }
}
