// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.opbatch.rpc;

import com.fasterxml.jackson.core.JsonProcessingException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;

import sh.opbatch.core.DebugLogger;
import sh.opbatch.core.LogFormatter;
import sh.opbatch.core.error.RpcException;
import sh.opbatch.core.model.UserOperation;
import sh.opbatch.core.types.Address;
import sh.opbatch.core.types.Wei;
import sh.opbatch.rpc.internal.RpcUtils;

final class DefaultBundlerClient implements BundlerClient {

    static final String METHOD_GAS_PRICE = "eth_gasPrice";
    static final String METHOD_SEND_BUNDLE = "eth_sendUserOperationBundle";

    private final BundlerProvider provider;

    DefaultBundlerClient(final BundlerProvider provider) {
        this.provider = Objects.requireNonNull(provider, "provider");
    }

    @Override
    public Wei gasPrice() {
        final JsonRpcResponse response = provider.send(METHOD_GAS_PRICE, List.of());
        final String raw = response.resultAsString();
        if (raw == null) {
            throw new RpcException(-32700, METHOD_GAS_PRICE + " returned no result", null, null);
        }
        try {
            return Wei.fromQuantity(raw);
        } catch (IllegalArgumentException e) {
            throw new RpcException(-32700, METHOD_GAS_PRICE + " returned a non-numeric result", raw, null, e);
        }
    }

    @Override
    public BundleReceipt sendBundle(final List<UserOperation> operations, final Address entryPoint) {
        Objects.requireNonNull(operations, "operations");
        Objects.requireNonNull(entryPoint, "entryPoint");
        final List<Map<String, Object>> ops = new ArrayList<>(operations.size());
        for (UserOperation op : operations) {
            ops.add(op.toRpcObject());
        }
        DebugLogger.logRpc(LogFormatter.formatBundleSend(ops.size(), entryPoint.value()));
        final JsonRpcResponse response = provider.send(METHOD_SEND_BUNDLE, List.of(ops, entryPoint.value()));
        return toReceipt(response.result());
    }

    private static BundleReceipt toReceipt(final Object result) {
        if (result == null || result instanceof String || result instanceof Number || result instanceof Boolean) {
            return new BundleReceipt(String.valueOf(result));
        }
        try {
            return new BundleReceipt(RpcUtils.MAPPER.writeValueAsString(result));
        } catch (JsonProcessingException e) {
            throw new RpcException(-32700, "Unable to render bundle receipt", null, null, e);
        }
    }
}
