package com.vclient.core;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.vclient.core.api.IHttpTransport;
import com.vclient.core.http.BackoffCalculator;
import com.vclient.core.http.ErrorClassifier;
import com.vclient.core.http.JdkHttpTransport;
import com.vclient.core.http.PaginationCursor;
import com.vclient.core.http.RequestExecutor;
import com.vclient.core.model.ClientConfig;
import com.vclient.core.service.ApiService;
import com.vclient.core.service.CampaignsService;
import com.vclient.core.service.CharactersService;
import com.vclient.core.service.CompaniesService;
import com.vclient.core.service.DicerollsService;
import com.vclient.core.service.SystemService;
import com.vclient.core.service.UsersService;
import com.vclient.core.util.DefaultSleeper;
import com.vclient.core.util.JsonUtil;
import com.vclient.core.util.Sleeper;
import com.vclient.core.util.YamlConfigLoader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Objects;

/**
 * Entry point: owns the transport, the retrying executor and the paging cursor, and hands out
 * resource services bound to it.
 * <pre>
 * try (VClient client = new VClient(ClientConfig.builder()
 *         .baseUrl("https://api.example.com").apiKey(key).defaultCompanyId(companyId).build())) {
 *     List&lt;Campaign&gt; campaigns = client.campaigns(userId).listAll();
 * }
 * </pre>
 * Thread-safe once built. Services are cheap views and may be created per call.
 */
public final class VClient implements AutoCloseable {
    private static final Logger LOG = LoggerFactory.getLogger(VClient.class);

    private final ClientConfig config;
    private final ObjectMapper mapper;
    private final IHttpTransport transport;
    private final RequestExecutor executor;
    private final PaginationCursor pagination;
    private volatile boolean closed;

    /** Production client over {@link JdkHttpTransport}. */
    public VClient(ClientConfig config) {
        this(config, null, DefaultSleeper.INSTANCE);
    }

    /** DI/test constructor. A null transport means {@link JdkHttpTransport}. */
    public VClient(ClientConfig config, IHttpTransport transport, Sleeper sleeper) {
        this.config = Objects.requireNonNull(config, "config");
        this.mapper = JsonUtil.newMapper();
        this.transport = (transport != null) ? transport : new JdkHttpTransport(config, mapper);
        this.executor = new RequestExecutor(
                this.transport,
                config,
                new ErrorClassifier(mapper, config.getServerErrorUpperBound()),
                new BackoffCalculator(config.getRetryDelay()),
                Objects.requireNonNull(sleeper, "sleeper"));
        this.pagination = new PaginationCursor(executor, mapper);
        LOG.debug("VClient created: {}", config);
    }

    /** Client configured from a {@code vclient.yml} file. */
    public static VClient fromYaml(Path yamlPath) throws IOException {
        return new VClient(YamlConfigLoader.load(yamlPath));
    }

    // ---------- plumbing ----------
    public ClientConfig config() { return config; }
    public ObjectMapper mapper() { return mapper; }
    public RequestExecutor executor() { ensureOpen(); return executor; }
    public PaginationCursor pagination() { ensureOpen(); return pagination; }

    /**
     * {@code companyId} when given, else the configured default.
     * @throws IllegalArgumentException when neither is set
     */
    public String resolveCompanyId(String companyId) {
        if (companyId != null && !companyId.isBlank()) return companyId;
        String def = config.getDefaultCompanyId();
        if (def == null || def.isBlank()) {
            throw new IllegalArgumentException("companyId is required (no defaultCompanyId configured)");
        }
        return def;
    }

    // ---------- services ----------
    public ApiService http() { return new ApiService(this); }
    public SystemService system() { return new SystemService(this); }
    public CompaniesService companies() { return new CompaniesService(this); }

    public UsersService users() { return users(null); }
    public UsersService users(String companyId) {
        return new UsersService(this, resolveCompanyId(companyId));
    }

    public CampaignsService campaigns(String userId) { return campaigns(userId, null); }
    public CampaignsService campaigns(String userId, String companyId) {
        return new CampaignsService(this, resolveCompanyId(companyId), userId);
    }

    public CharactersService characters(String userId, String campaignId) { return characters(userId, campaignId, null); }
    public CharactersService characters(String userId, String campaignId, String companyId) {
        return new CharactersService(this, resolveCompanyId(companyId), userId, campaignId);
    }

    public DicerollsService dicerolls(String userId) { return dicerolls(userId, null); }
    public DicerollsService dicerolls(String userId, String companyId) {
        return new DicerollsService(this, resolveCompanyId(companyId), userId);
    }

    // ---------- lifecycle ----------
    public boolean isClosed() { return closed; }

    private void ensureOpen() {
        if (closed) throw new IllegalStateException("VClient is closed");
    }

    /** Closes the transport. Later calls fail with {@link IllegalStateException}. Idempotent. */
    @Override
    public void close() {
        if (closed) return;
        closed = true;
        transport.close();
        LOG.debug("VClient closed");
    }
}
