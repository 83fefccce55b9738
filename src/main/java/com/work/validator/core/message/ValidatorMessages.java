package com.work.validator.core.message;

import com.work.validator.core.exception.InvalidWarpMessageException;
import com.work.validator.core.model.Bytes32;
import com.work.validator.core.model.ConversionData;
import com.work.validator.core.model.InitialValidator;
import com.work.validator.core.model.NodeId;
import com.work.validator.core.model.PChainOwner;
import com.work.validator.core.support.Addresses;
import org.web3j.crypto.Hash;

import java.io.ByteArrayOutputStream;
import java.nio.BufferUnderflowException;
import java.nio.ByteBuffer;
import java.util.ArrayList;
import java.util.List;

/**
 * P-Chain 消息的默认编码实现（codec 版本 0，大端序）。
 *
 * <pre>
 * SubnetToL1ConversionMessage  codec(2) type=0(4) conversionID(32)
 * RegisterL1ValidatorMessage   codec(2) type=1(4) subnetID(32) nodeIDLen(4) nodeID blsKey(48) expiry(8)
 *                              remainingBalanceOwner{threshold(4) count(4) addr(20)*} disableOwner{...} weight(8)
 * L1ValidatorRegistration      codec(2) type=2(4) validationID(32) valid(1)
 * L1ValidatorWeightMessage     codec(2) type=3(4) validationID(32) nonce(8) weight(8)
 * ValidationUptimeMessage      codec(2) type=0(4) validationID(32) uptime(8)
 * </pre>
 */
public class ValidatorMessages implements ValidatorMessageCodec {

    public static final short CODEC_ID = 0;
    public static final int SUBNET_TO_L1_CONVERSION_MESSAGE_TYPE_ID = 0;
    public static final int REGISTER_L1_VALIDATOR_MESSAGE_TYPE_ID = 1;
    public static final int L1_VALIDATOR_REGISTRATION_MESSAGE_TYPE_ID = 2;
    public static final int L1_VALIDATOR_WEIGHT_MESSAGE_TYPE_ID = 3;
    public static final int VALIDATION_UPTIME_MESSAGE_TYPE_ID = 0;

    private static final int HEADER_LENGTH = 6;
    private static final int BLS_PUBLIC_KEY_LENGTH = 48;

    @Override
    public Bytes32 conversionId(ConversionData conversionData) {
        return Bytes32.wrap(Hash.sha256(packConversionData(conversionData)));
    }

    @Override
    public byte[] packConversionData(ConversionData conversionData) {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        writeShort(out, CODEC_ID);
        writeBytes(out, conversionData.getSubnetId().toArray());
        writeBytes(out, conversionData.getValidatorManagerBlockchainId().toArray());
        writeInt(out, Addresses.ADDRESS_LENGTH);
        writeBytes(out, Addresses.toBytes(conversionData.getValidatorManagerAddress()));
        List<InitialValidator> validators = conversionData.getInitialValidators();
        writeInt(out, validators.size());
        for (InitialValidator validator : validators) {
            byte[] nodeId = validator.getNodeId().toArray();
            writeInt(out, nodeId.length);
            writeBytes(out, nodeId);
            writeLong(out, validator.getWeight());
            writeBytes(out, validator.getBlsPublicKey());
        }
        return out.toByteArray();
    }

    @Override
    public Bytes32 initialValidationId(Bytes32 subnetId, int index) {
        ByteBuffer buffer = ByteBuffer.allocate(Bytes32.LENGTH + 4);
        buffer.put(subnetId.toArray());
        buffer.putInt(index);
        return Bytes32.wrap(Hash.sha256(buffer.array()));
    }

    @Override
    public Bytes32 registrationValidationId(byte[] registerMessage) {
        return Bytes32.wrap(Hash.sha256(registerMessage));
    }

    @Override
    public byte[] packSubnetToL1ConversionMessage(Bytes32 conversionId) {
        return header(SUBNET_TO_L1_CONVERSION_MESSAGE_TYPE_ID, Bytes32.LENGTH)
                .put(conversionId.toArray())
                .array();
    }

    @Override
    public Bytes32 unpackSubnetToL1ConversionMessage(byte[] payload) {
        ByteBuffer buffer = open(payload, SUBNET_TO_L1_CONVERSION_MESSAGE_TYPE_ID, HEADER_LENGTH + Bytes32.LENGTH);
        return readBytes32(buffer);
    }

    @Override
    public byte[] packRegisterL1ValidatorMessage(RegisterL1ValidatorMessage message) {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        writeShort(out, CODEC_ID);
        writeInt(out, REGISTER_L1_VALIDATOR_MESSAGE_TYPE_ID);
        writeBytes(out, message.getSubnetId().toArray());
        byte[] nodeId = message.getNodeId().toArray();
        writeInt(out, nodeId.length);
        writeBytes(out, nodeId);
        writeBytes(out, message.getBlsPublicKey());
        writeLong(out, message.getRegistrationExpiry());
        writeOwner(out, message.getRemainingBalanceOwner());
        writeOwner(out, message.getDisableOwner());
        writeLong(out, message.getWeight());
        return out.toByteArray();
    }

    @Override
    public RegisterL1ValidatorMessage unpackRegisterL1ValidatorMessage(byte[] payload) {
        ByteBuffer buffer = open(payload, REGISTER_L1_VALIDATOR_MESSAGE_TYPE_ID, -1);
        try {
            Bytes32 subnetId = readBytes32(buffer);
            int nodeIdLength = buffer.getInt();
            if (nodeIdLength < 0 || nodeIdLength > buffer.remaining()) {
                throw invalidLength(payload.length);
            }
            byte[] nodeId = new byte[nodeIdLength];
            buffer.get(nodeId);
            byte[] blsPublicKey = new byte[BLS_PUBLIC_KEY_LENGTH];
            buffer.get(blsPublicKey);
            long expiry = buffer.getLong();
            PChainOwner remainingBalanceOwner = readOwner(buffer, payload.length);
            PChainOwner disableOwner = readOwner(buffer, payload.length);
            long weight = buffer.getLong();
            if (buffer.hasRemaining()) {
                throw invalidLength(payload.length);
            }
            return new RegisterL1ValidatorMessage(subnetId, NodeId.of(nodeId), blsPublicKey, expiry,
                    remainingBalanceOwner, disableOwner, weight);
        } catch (BufferUnderflowException e) {
            throw invalidLength(payload.length);
        }
    }

    @Override
    public byte[] packL1ValidatorRegistrationMessage(L1ValidatorRegistrationMessage message) {
        return header(L1_VALIDATOR_REGISTRATION_MESSAGE_TYPE_ID, Bytes32.LENGTH + 1)
                .put(message.getValidationId().toArray())
                .put((byte) (message.isValid() ? 1 : 0))
                .array();
    }

    @Override
    public L1ValidatorRegistrationMessage unpackL1ValidatorRegistrationMessage(byte[] payload) {
        ByteBuffer buffer = open(payload, L1_VALIDATOR_REGISTRATION_MESSAGE_TYPE_ID,
                HEADER_LENGTH + Bytes32.LENGTH + 1);
        Bytes32 validationId = readBytes32(buffer);
        boolean valid = buffer.get() != 0;
        return new L1ValidatorRegistrationMessage(validationId, valid);
    }

    @Override
    public byte[] packL1ValidatorWeightMessage(L1ValidatorWeightMessage message) {
        return header(L1_VALIDATOR_WEIGHT_MESSAGE_TYPE_ID, Bytes32.LENGTH + 16)
                .put(message.getValidationId().toArray())
                .putLong(message.getNonce())
                .putLong(message.getWeight())
                .array();
    }

    @Override
    public L1ValidatorWeightMessage unpackL1ValidatorWeightMessage(byte[] payload) {
        ByteBuffer buffer = open(payload, L1_VALIDATOR_WEIGHT_MESSAGE_TYPE_ID, HEADER_LENGTH + Bytes32.LENGTH + 16);
        return new L1ValidatorWeightMessage(readBytes32(buffer), buffer.getLong(), buffer.getLong());
    }

    @Override
    public byte[] packValidationUptimeMessage(ValidationUptimeMessage message) {
        return header(VALIDATION_UPTIME_MESSAGE_TYPE_ID, Bytes32.LENGTH + 8)
                .put(message.getValidationId().toArray())
                .putLong(message.getUptimeSeconds())
                .array();
    }

    @Override
    public ValidationUptimeMessage unpackValidationUptimeMessage(byte[] payload) {
        ByteBuffer buffer = open(payload, VALIDATION_UPTIME_MESSAGE_TYPE_ID, HEADER_LENGTH + Bytes32.LENGTH + 8);
        return new ValidationUptimeMessage(readBytes32(buffer), buffer.getLong());
    }

    private static ByteBuffer header(int typeId, int bodyLength) {
        ByteBuffer buffer = ByteBuffer.allocate(HEADER_LENGTH + bodyLength);
        buffer.putShort(CODEC_ID);
        buffer.putInt(typeId);
        return buffer;
    }

    /**
     * 校验长度（expectedLength 为 -1 时只校验头部）、codec 版本与消息类型，返回定位到消息体的 buffer。
     */
    private static ByteBuffer open(byte[] payload, int typeId, int expectedLength) {
        if (payload == null) {
            throw invalidLength(0);
        }
        if (expectedLength >= 0 ? payload.length != expectedLength : payload.length < HEADER_LENGTH) {
            throw invalidLength(payload.length);
        }
        ByteBuffer buffer = ByteBuffer.wrap(payload);
        short codecId = buffer.getShort();
        if (codecId != CODEC_ID) {
            throw new InvalidWarpMessageException("InvalidCodecID", "unexpected codec id " + codecId);
        }
        int actualType = buffer.getInt();
        if (actualType != typeId) {
            throw new InvalidWarpMessageException("InvalidMessageType",
                    "expected message type " + typeId + " but got " + actualType);
        }
        return buffer;
    }

    private static InvalidWarpMessageException invalidLength(int length) {
        return new InvalidWarpMessageException("InvalidMessageLength", "unexpected payload length " + length);
    }

    private static Bytes32 readBytes32(ByteBuffer buffer) {
        byte[] bytes = new byte[Bytes32.LENGTH];
        buffer.get(bytes);
        return Bytes32.wrap(bytes);
    }

    private static PChainOwner readOwner(ByteBuffer buffer, int payloadLength) {
        int threshold = buffer.getInt();
        int count = buffer.getInt();
        if (count < 0 || (long) count * Addresses.ADDRESS_LENGTH > buffer.remaining()) {
            throw invalidLength(payloadLength);
        }
        List<String> addresses = new ArrayList<>(count);
        for (int i = 0; i < count; i++) {
            byte[] address = new byte[Addresses.ADDRESS_LENGTH];
            buffer.get(address);
            addresses.add(Addresses.fromBytes(address));
        }
        return new PChainOwner(threshold, addresses);
    }

    private static void writeOwner(ByteArrayOutputStream out, PChainOwner owner) {
        writeInt(out, owner.getThreshold());
        writeInt(out, owner.getAddresses().size());
        for (String address : owner.getAddresses()) {
            writeBytes(out, Addresses.toBytes(address));
        }
    }

    private static void writeShort(ByteArrayOutputStream out, short value) {
        writeBytes(out, ByteBuffer.allocate(2).putShort(value).array());
    }

    private static void writeInt(ByteArrayOutputStream out, int value) {
        writeBytes(out, ByteBuffer.allocate(4).putInt(value).array());
    }

    private static void writeLong(ByteArrayOutputStream out, long value) {
        writeBytes(out, ByteBuffer.allocate(8).putLong(value).array());
    }

    private static void writeBytes(ByteArrayOutputStream out, byte[] bytes) {
        out.write(bytes, 0, bytes.length);
    }
}
