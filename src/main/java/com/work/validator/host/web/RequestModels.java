package com.work.validator.host.web;

import com.work.validator.core.model.Bytes32;
import com.work.validator.core.model.ConversionData;
import com.work.validator.core.model.InitialValidator;
import com.work.validator.core.model.NodeId;
import com.work.validator.core.model.ValidatorRegistrationRequest;
import com.work.validator.core.staking.StakingValidatorRequest;
import com.work.validator.host.web.dto.InitialValidatorDto;
import com.work.validator.host.web.dto.InitializeValidatorSetRequest;
import com.work.validator.host.web.dto.RegisterValidatorRequest;
import com.work.validator.host.web.dto.StakingValidatorRequestDto;
import org.web3j.utils.Numeric;

import java.util.ArrayList;
import java.util.List;

/**
 * 请求 DTO 到引擎模型的转换。十六进制解析失败抛 IllegalArgumentException，由异常处理映射为 400。
 */
final class RequestModels {

    private RequestModels() {
        throw new AssertionError("工具类不允许实例化");
    }

    static ConversionData toConversionData(InitializeValidatorSetRequest req) {
        List<InitialValidator> validators = new ArrayList<>();
        for (InitialValidatorDto dto : req.getInitialValidators()) {
            validators.add(new InitialValidator(NodeId.fromHex(dto.getNodeId()),
                    Numeric.hexStringToByteArray(dto.getBlsPublicKey()), dto.getWeight()));
        }
        return new ConversionData(Bytes32.fromHex(req.getSubnetId()),
                Bytes32.fromHex(req.getValidatorManagerBlockchainId()),
                req.getValidatorManagerAddress(), validators);
    }

    static ValidatorRegistrationRequest toRegistration(RegisterValidatorRequest req) {
        return new ValidatorRegistrationRequest(
                NodeId.fromHex(req.getNodeId()),
                Numeric.hexStringToByteArray(req.getBlsPublicKey()),
                req.getRegistrationExpiry(),
                req.getRemainingBalanceOwner().toModel(),
                req.getDisableOwner().toModel(),
                req.getWeight());
    }

    static StakingValidatorRequest toStakingRegistration(StakingValidatorRequestDto req) {
        return new StakingValidatorRequest(toRegistration(req), req.getDelegationFeeBips(),
                req.getMinStakeDuration(), req.getStakeAmount(), req.getRewardRecipient());
    }
}
