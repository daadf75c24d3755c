package com.vclient.core.service;

import com.vclient.core.VClient;
import com.vclient.core.model.SystemHealth;

public final class SystemService extends BaseService {

    public SystemService(VClient client) {
        super(client);
    }

    /** {@code GET /health}. Needs no company scope. */
    public SystemHealth health() {
        return parse(doGet(Endpoints.HEALTH), SystemHealth.class);
    }
}
