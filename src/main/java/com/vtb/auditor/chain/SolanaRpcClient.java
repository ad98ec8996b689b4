package com.vtb.auditor.chain;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.vtb.auditor.config.AuditorConfig;
import lombok.extern.slf4j.Slf4j;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;

import java.io.IOException;
import java.net.SocketTimeoutException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Base64;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

/**
 * JSON-RPC клиент Solana поверх OkHttp.
 * Сетевые ошибки, HTTP 429/5xx и "node unhealthy" повторяются через {@link RetryPolicy}.
 */
@Slf4j
public class SolanaRpcClient implements CommittingChainClient {

    private static final MediaType JSON = MediaType.parse("application/json");
    private static final String USER_AGENT = "VTB-Chain-Auditor/1.0";
    private static final int MULTIPLE_ACCOUNTS_CHUNK = 100;
    private static final long CONFIRM_POLL_MS = 500L;

    private final String endpoint;
    private final String commitment;
    private final OkHttpClient httpClient;
    private final RetryPolicy retryPolicy;
    private final ObjectMapper mapper = new ObjectMapper();
    private final AtomicLong requestIds = new AtomicLong();

    public SolanaRpcClient(AuditorConfig.Cluster cluster, AuditorConfig.Rpc rpc) {
        this(cluster.resolveRpcUrl(), cluster.getCommitment(),
            new OkHttpClient.Builder()
                .connectTimeout(rpc.getConnectTimeoutSec(), TimeUnit.SECONDS)
                .readTimeout(rpc.getCallTimeoutSec(), TimeUnit.SECONDS)
                .writeTimeout(rpc.getCallTimeoutSec(), TimeUnit.SECONDS)
                .callTimeout(rpc.getCallTimeoutSec(), TimeUnit.SECONDS)
                .retryOnConnectionFailure(false)
                .build(),
            RetryPolicy.fromConfig(rpc));
    }

    public SolanaRpcClient(String endpoint, String commitment, OkHttpClient httpClient, RetryPolicy retryPolicy) {
        this.endpoint = endpoint;
        this.commitment = commitment != null ? commitment : "confirmed";
        this.httpClient = httpClient;
        this.retryPolicy = retryPolicy;
    }

    @Override
    public String endpoint() {
        return endpoint;
    }

    @Override
    public AccountInfo getAccountInfo(String address) {
        ArrayNode params = mapper.createArrayNode();
        params.add(address);
        params.add(encodingConfig());
        JsonNode value = call("getAccountInfo", params).path("value");
        return parseAccount(address, value);
    }

    @Override
    public Map<String, AccountInfo> getMultipleAccounts(List<String> addresses) {
        Map<String, AccountInfo> accounts = new LinkedHashMap<>();
        for (int from = 0; from < addresses.size(); from += MULTIPLE_ACCOUNTS_CHUNK) {
            List<String> chunk = addresses.subList(from, Math.min(addresses.size(), from + MULTIPLE_ACCOUNTS_CHUNK));
            ArrayNode params = mapper.createArrayNode();
            ArrayNode keys = params.addArray();
            chunk.forEach(keys::add);
            params.add(encodingConfig());
            JsonNode values = call("getMultipleAccounts", params).path("value");
            for (int i = 0; i < chunk.size(); i++) {
                accounts.put(chunk.get(i), parseAccount(chunk.get(i), values.path(i)));
            }
        }
        return accounts;
    }

    @Override
    public List<AccountInfo> getProgramAccounts(String programId) {
        ArrayNode params = mapper.createArrayNode();
        params.add(programId);
        params.add(encodingConfig());
        JsonNode result = call("getProgramAccounts", params);
        List<AccountInfo> accounts = new ArrayList<>();
        JsonNode items = result.isArray() ? result : result.path("value");
        for (JsonNode item : items) {
            AccountInfo account = parseAccount(item.path("pubkey").asText(), item.path("account"));
            if (account != null) {
                accounts.add(account);
            }
        }
        return accounts;
    }

    @Override
    public RpcSimulationResult simulateTransaction(byte[] serializedTransaction, List<String> postAccounts) {
        ArrayNode params = mapper.createArrayNode();
        params.add(Base64.getEncoder().encodeToString(serializedTransaction));
        ObjectNode config = params.addObject();
        config.put("encoding", "base64");
        config.put("commitment", commitment);
        config.put("sigVerify", false);
        config.put("replaceRecentBlockhash", true);
        if (postAccounts != null && !postAccounts.isEmpty()) {
            ObjectNode accounts = config.putObject("accounts");
            accounts.put("encoding", "base64");
            ArrayNode addresses = accounts.putArray("addresses");
            postAccounts.forEach(addresses::add);
        }

        JsonNode value = call("simulateTransaction", params).path("value");
        Map<String, AccountInfo> post = null;
        JsonNode accountsNode = value.path("accounts");
        if (postAccounts != null && accountsNode.isArray()) {
            post = new LinkedHashMap<>();
            for (int i = 0; i < postAccounts.size(); i++) {
                post.put(postAccounts.get(i), parseAccount(postAccounts.get(i), accountsNode.path(i)));
            }
        }
        return RpcSimulationResult.builder()
            .err(nullIfMissing(value.get("err")))
            .logs(readLogs(value.path("logs")))
            .unitsConsumed(value.hasNonNull("unitsConsumed") ? value.get("unitsConsumed").asLong() : null)
            .postAccounts(post)
            .build();
    }

    @Override
    public byte[] getLatestBlockhash() {
        ArrayNode params = mapper.createArrayNode();
        params.addObject().put("commitment", commitment);
        String blockhash = call("getLatestBlockhash", params).path("value").path("blockhash").asText(null);
        if (blockhash == null) {
            throw new ChainClientException("getLatestBlockhash вернул пустой ответ", false);
        }
        return PublicKeys.decode(blockhash);
    }

    @Override
    public boolean isHealthy() {
        try {
            JsonNode result = call("getHealth", mapper.createArrayNode());
            return "ok".equalsIgnoreCase(result.asText());
        } catch (ChainClientException e) {
            log.debug("getHealth не прошел: {}", e.getMessage());
            return false;
        }
    }

    @Override
    public String sendTransaction(byte[] serializedTransaction) {
        ArrayNode params = mapper.createArrayNode();
        params.add(Base64.getEncoder().encodeToString(serializedTransaction));
        ObjectNode config = params.addObject();
        config.put("encoding", "base64");
        config.put("preflightCommitment", commitment);
        // повтор отправки может задвоить транзакцию
        return RetryPolicy.none().execute("sendTransaction", () -> doCall("sendTransaction", params)).asText();
    }

    @Override
    public RpcSimulationResult confirmTransaction(String signature, Duration timeout) {
        long deadline = System.nanoTime() + timeout.toNanos();
        while (true) {
            ArrayNode params = mapper.createArrayNode();
            params.addArray().add(signature);
            JsonNode status = call("getSignatureStatuses", params).path("value").path(0);
            String confirmation = status.path("confirmationStatus").asText("");
            if ("confirmed".equals(confirmation) || "finalized".equals(confirmation)) {
                break;
            }
            if (System.nanoTime() > deadline) {
                throw new ChainClientException("Транзакция " + signature + " не подтверждена за "
                    + timeout.toSeconds() + " с", false);
            }
            try {
                Thread.sleep(CONFIRM_POLL_MS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new ChainClientException("Ожидание подтверждения прервано", e, false);
            }
        }

        ArrayNode params = mapper.createArrayNode();
        params.add(signature);
        ObjectNode config = params.addObject();
        config.put("encoding", "json");
        config.put("commitment", "confirmed");
        config.put("maxSupportedTransactionVersion", 0);
        JsonNode meta = call("getTransaction", params).path("meta");
        return RpcSimulationResult.builder()
            .err(nullIfMissing(meta.get("err")))
            .logs(readLogs(meta.path("logMessages")))
            .unitsConsumed(meta.hasNonNull("computeUnitsConsumed") ? meta.get("computeUnitsConsumed").asLong() : null)
            .signature(signature)
            .build();
    }

    private JsonNode call(String method, ArrayNode params) {
        return retryPolicy.execute(method, () -> doCall(method, params));
    }

    private JsonNode doCall(String method, ArrayNode params) {
        ObjectNode body = mapper.createObjectNode();
        body.put("jsonrpc", "2.0");
        body.put("id", requestIds.incrementAndGet());
        body.put("method", method);
        body.set("params", params);

        Request request;
        try {
            request = new Request.Builder()
                .url(endpoint)
                .addHeader("User-Agent", USER_AGENT)
                .post(RequestBody.create(mapper.writeValueAsString(body), JSON))
                .build();
        } catch (JsonProcessingException e) {
            throw new ChainClientException("Не удалось сериализовать запрос " + method, e, false);
        }

        log.debug("RPC -> {} {}", method, endpoint);
        try (Response response = httpClient.newCall(request).execute()) {
            int code = response.code();
            String text = response.body() != null ? response.body().string() : "";
            if (code == 429 || code >= 500) {
                throw new ChainClientException("RPC " + method + ": HTTP " + code, true);
            }
            if (!response.isSuccessful()) {
                throw new ChainClientException("RPC " + method + ": HTTP " + code + " " + truncate(text, 200), false);
            }
            JsonNode json = mapper.readTree(text);
            JsonNode error = json.get("error");
            if (error != null && !error.isNull()) {
                throw new RpcErrorException(method, error.path("code").asInt(),
                    error.path("message").asText(""), error.get("data"));
            }
            return json.path("result");
        } catch (JsonProcessingException e) {
            throw new ChainClientException("Некорректный JSON в ответе " + method + ": " + e.getOriginalMessage(), e, false);
        } catch (SocketTimeoutException e) {
            throw new ChainClientException("Таймаут RPC " + method, e, true);
        } catch (IOException e) {
            throw new ChainClientException("Сетевая ошибка RPC " + method + ": " + e.getMessage(), e, true);
        }
    }

    private ObjectNode encodingConfig() {
        ObjectNode config = mapper.createObjectNode();
        config.put("encoding", "base64");
        config.put("commitment", commitment);
        return config;
    }

    static AccountInfo parseAccount(String address, JsonNode node) {
        if (node == null || node.isNull() || node.isMissingNode()) {
            return null;
        }
        byte[] data = new byte[0];
        JsonNode dataNode = node.path("data");
        if (dataNode.isArray() && dataNode.size() > 0) {
            data = Base64.getDecoder().decode(dataNode.get(0).asText(""));
        } else if (dataNode.isTextual()) {
            data = Base64.getDecoder().decode(dataNode.asText());
        }
        return AccountInfo.builder()
            .address(address)
            .lamports(node.path("lamports").asLong())
            .owner(node.path("owner").asText(null))
            .executable(node.path("executable").asBoolean(false))
            .data(data)
            .build();
    }

    private static List<String> readLogs(JsonNode node) {
        List<String> logs = new ArrayList<>();
        if (node != null && node.isArray()) {
            node.forEach(entry -> logs.add(entry.asText()));
        }
        return logs;
    }

    private static JsonNode nullIfMissing(JsonNode node) {
        return node == null || node.isNull() ? null : node;
    }

    private static String truncate(String text, int limit) {
        if (text == null || text.length() <= limit) {
            return text;
        }
        return text.substring(0, limit) + "...";
    }
}
