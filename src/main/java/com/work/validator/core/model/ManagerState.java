package com.work.validator.core.model;

public class ManagerState {

    private boolean initialized;
    private ManagementMode mode;

    public ManagerState(boolean initialized, ManagementMode mode) {
        this.initialized = initialized;
        this.mode = mode == null ? ManagementMode.PROOF_OF_AUTHORITY : mode;
    }

    public static ManagerState uninitialized() {
        return new ManagerState(false, ManagementMode.PROOF_OF_AUTHORITY);
    }

    public ManagerState copy() {
        return new ManagerState(initialized, mode);
    }

    public boolean isInitialized() {
        return initialized;
    }

    public void setInitialized(boolean initialized) {
        this.initialized = initialized;
    }

    public ManagementMode getMode() {
        return mode;
    }

    public void setMode(ManagementMode mode) {
        this.mode = mode;
    }
}
