package com.work.validator.host.web.dto;

public class ManagerStatusView {

    private String subnetId;
    private boolean initialized;
    private String mode;
    private String admin;
    private long totalWeight;
    private long remainingChurn;

    public String getSubnetId() {
        return subnetId;
    }

    public void setSubnetId(String subnetId) {
        this.subnetId = subnetId;
    }

    public boolean isInitialized() {
        return initialized;
    }

    public void setInitialized(boolean initialized) {
        this.initialized = initialized;
    }

    public String getMode() {
        return mode;
    }

    public void setMode(String mode) {
        this.mode = mode;
    }

    public String getAdmin() {
        return admin;
    }

    public void setAdmin(String admin) {
        this.admin = admin;
    }

    public long getTotalWeight() {
        return totalWeight;
    }

    public void setTotalWeight(long totalWeight) {
        this.totalWeight = totalWeight;
    }

    public long getRemainingChurn() {
        return remainingChurn;
    }

    public void setRemainingChurn(long remainingChurn) {
        this.remainingChurn = remainingChurn;
    }
}
