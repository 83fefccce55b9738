package com.work.validator.core.staking.asset;

/**
 * 以链原生币质押，奖励通过原生币铸造发放。
 */
public class NativeTokenAssetAdapter extends InMemoryAssetLedger {

    @Override
    public String assetName() {
        return "native";
    }
}
