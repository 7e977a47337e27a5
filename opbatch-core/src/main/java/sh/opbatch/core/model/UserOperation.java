// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.opbatch.core.model;

import java.math.BigInteger;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

import org.jspecify.annotations.Nullable;

import sh.opbatch.core.types.Address;
import sh.opbatch.core.types.HexData;
import sh.opbatch.core.types.Wei;
import sh.opbatch.primitives.Hex;

/**
 * An already-signed ERC-4337 user operation (EntryPoint v0.6 layout).
 *
 * <p>
 * Numeric fields are parsed into {@link BigInteger} / {@link Wei} when the operation
 * is read and are only rendered back to {@code 0x} quantities by {@link #toRpcObject()}.
 * All comparisons in the batcher therefore run on numbers, never on hex text.
 *
 * <p>
 * Instances are immutable; {@link #withDefaultFees(GasFees)} returns a copy.
 *
 * @param sender               the smart account address
 * @param nonce                the account nonce
 * @param initCode             account factory payload, {@link HexData#EMPTY} for deployed accounts
 * @param callData             the call executed by the account
 * @param callGasLimit         gas for the main call
 * @param verificationGasLimit gas for validation
 * @param preVerificationGas   gas paid to the bundler for overhead
 * @param maxFeePerGas         EIP-1559 max fee, zero when unset
 * @param maxPriorityFeePerGas EIP-1559 tip, zero when unset
 * @param paymasterAndData     sponsor payload, {@link HexData#EMPTY} when self-funded
 * @param signature            account signature over the operation
 * @since 0.1.0
 */
public record UserOperation(
        Address sender,
        BigInteger nonce,
        HexData initCode,
        HexData callData,
        BigInteger callGasLimit,
        BigInteger verificationGasLimit,
        BigInteger preVerificationGas,
        Wei maxFeePerGas,
        Wei maxPriorityFeePerGas,
        HexData paymasterAndData,
        HexData signature) {

    static final String SENDER = "sender";
    static final String NONCE = "nonce";
    static final String INIT_CODE = "initCode";
    static final String CALL_DATA = "callData";
    static final String CALL_GAS_LIMIT = "callGasLimit";
    static final String VERIFICATION_GAS_LIMIT = "verificationGasLimit";
    static final String PRE_VERIFICATION_GAS = "preVerificationGas";
    static final String MAX_FEE_PER_GAS = "maxFeePerGas";
    static final String MAX_PRIORITY_FEE_PER_GAS = "maxPriorityFeePerGas";
    static final String PAYMASTER_AND_DATA = "paymasterAndData";
    static final String SIGNATURE = "signature";

    public UserOperation {
        Objects.requireNonNull(sender, "sender");
        Objects.requireNonNull(nonce, "nonce");
        initCode = initCode == null ? HexData.EMPTY : initCode;
        callData = callData == null ? HexData.EMPTY : callData;
        Objects.requireNonNull(callGasLimit, "callGasLimit");
        Objects.requireNonNull(verificationGasLimit, "verificationGasLimit");
        Objects.requireNonNull(preVerificationGas, "preVerificationGas");
        maxFeePerGas = maxFeePerGas == null ? Wei.ZERO : maxFeePerGas;
        maxPriorityFeePerGas = maxPriorityFeePerGas == null ? Wei.ZERO : maxPriorityFeePerGas;
        paymasterAndData = paymasterAndData == null ? HexData.EMPTY : paymasterAndData;
        signature = signature == null ? HexData.EMPTY : signature;
        requireNonNegative(nonce, NONCE);
        requireNonNegative(callGasLimit, CALL_GAS_LIMIT);
        requireNonNegative(verificationGasLimit, VERIFICATION_GAS_LIMIT);
        requireNonNegative(preVerificationGas, PRE_VERIFICATION_GAS);
    }

    /**
     * Returns {@code true} when either fee field is zero and should be filled from an estimate.
     *
     * @return whether {@link #withDefaultFees(GasFees)} would change this operation
     */
    public boolean hasUnsetFees() {
        return maxFeePerGas.isZero() || maxPriorityFeePerGas.isZero();
    }

    /**
     * Fills zero fee fields from the given estimate. Non-zero fields are kept as-is.
     *
     * @param fees the estimate
     * @return this instance when nothing is unset, otherwise a copy with the zero fields replaced
     */
    public UserOperation withDefaultFees(final GasFees fees) {
        Objects.requireNonNull(fees, "fees");
        if (!hasUnsetFees()) {
            return this;
        }
        return new UserOperation(
                sender,
                nonce,
                initCode,
                callData,
                callGasLimit,
                verificationGasLimit,
                preVerificationGas,
                maxFeePerGas.isZero() ? fees.maxFeePerGas() : maxFeePerGas,
                maxPriorityFeePerGas.isZero() ? fees.maxPriorityFeePerGas() : maxPriorityFeePerGas,
                paymasterAndData,
                signature);
    }

    /**
     * Renders the operation in the JSON-RPC wire shape: quantities as {@code 0x} hex,
     * byte fields as {@code 0x} hex strings, keys in canonical order.
     *
     * @return a mutable, insertion-ordered map
     */
    public Map<String, Object> toRpcObject() {
        final Map<String, Object> out = new LinkedHashMap<>();
        out.put(SENDER, sender.value());
        out.put(NONCE, Hex.encodeQuantity(nonce));
        out.put(INIT_CODE, initCode.value());
        out.put(CALL_DATA, callData.value());
        out.put(CALL_GAS_LIMIT, Hex.encodeQuantity(callGasLimit));
        out.put(VERIFICATION_GAS_LIMIT, Hex.encodeQuantity(verificationGasLimit));
        out.put(PRE_VERIFICATION_GAS, Hex.encodeQuantity(preVerificationGas));
        out.put(MAX_FEE_PER_GAS, maxFeePerGas.toHexString());
        out.put(MAX_PRIORITY_FEE_PER_GAS, maxPriorityFeePerGas.toHexString());
        out.put(PAYMASTER_AND_DATA, paymasterAndData.value());
        out.put(SIGNATURE, signature.value());
        return out;
    }

    /**
     * Parses the JSON-RPC wire shape produced by {@link #toRpcObject()}.
     *
     * <p>
     * {@code initCode}, {@code paymasterAndData}, {@code signature} and the fee fields
     * may be absent; the remaining fields are required.
     *
     * @param source decoded JSON object
     * @return the operation
     * @throws IllegalArgumentException if a required field is missing or malformed
     */
    public static UserOperation fromRpcObject(final Map<String, ?> source) {
        Objects.requireNonNull(source, "source");
        return new UserOperation(
                new Address(requireText(source, SENDER)),
                Hex.decodeQuantity(requireText(source, NONCE)),
                optionalBytes(source, INIT_CODE),
                optionalBytes(source, CALL_DATA),
                Hex.decodeQuantity(requireText(source, CALL_GAS_LIMIT)),
                Hex.decodeQuantity(requireText(source, VERIFICATION_GAS_LIMIT)),
                Hex.decodeQuantity(requireText(source, PRE_VERIFICATION_GAS)),
                optionalWei(source, MAX_FEE_PER_GAS),
                optionalWei(source, MAX_PRIORITY_FEE_PER_GAS),
                optionalBytes(source, PAYMASTER_AND_DATA),
                optionalBytes(source, SIGNATURE));
    }

    private static String requireText(final Map<String, ?> source, final String key) {
        final String text = text(source, key);
        if (text == null) {
            throw new IllegalArgumentException("UserOperation is missing field '" + key + "'");
        }
        return text;
    }

    private static @Nullable String text(final Map<String, ?> source, final String key) {
        final Object raw = source.get(key);
        if (raw == null) {
            return null;
        }
        if (raw instanceof Number number) {
            return number.toString();
        }
        if (raw instanceof String s) {
            return s;
        }
        throw new IllegalArgumentException("UserOperation field '" + key + "' must be a string, got " + raw);
    }

    private static @Nullable HexData optionalBytes(final Map<String, ?> source, final String key) {
        final String text = text(source, key);
        return text == null ? null : new HexData(text);
    }

    private static @Nullable Wei optionalWei(final Map<String, ?> source, final String key) {
        final String text = text(source, key);
        return text == null ? null : Wei.fromQuantity(text);
    }

    private static void requireNonNegative(final BigInteger value, final String name) {
        if (value.signum() < 0) {
            throw new IllegalArgumentException(name + " must be non-negative");
        }
    }
}
