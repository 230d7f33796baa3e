package io.fieldledger.api;

import io.fieldledger.core.SyncTransportException;
import io.fieldledger.engine.sync.PullRequest;
import io.fieldledger.engine.sync.PullResponse;
import io.fieldledger.engine.sync.PushReceipt;
import io.fieldledger.engine.sync.RemoteAuthority;
import io.fieldledger.engine.sync.SyncBatch;
import org.springframework.http.MediaType;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

/** {@link RemoteAuthority} reached over the authority endpoints of another node. */
public class HttpRemoteAuthority implements RemoteAuthority {
    private final RestClient http;

    public HttpRemoteAuthority(RestClient http) {
        this.http = http;
    }

    @Override
    public PushReceipt push(SyncBatch batch) {
        try {
            var receipt = http.post()
                    .uri("/api/sync/{op}/push", batch.operationId())
                    .contentType(MediaType.APPLICATION_JSON)
                    .body(batch)
                    .retrieve()
                    .body(PushReceipt.class);
            if (receipt == null) throw new SyncTransportException("empty push receipt for " + batch.operationId());
            return receipt;
        } catch (RestClientException e) {
            throw new SyncTransportException("push to authority failed: " + e.getMessage(), e);
        }
    }

    @Override
    public PullResponse pull(PullRequest request) {
        try {
            var response = http.get()
                    .uri("/api/sync/{op}/pull?since={since}", request.operationId(), request.sinceSequence())
                    .retrieve()
                    .body(PullResponse.class);
            if (response == null) throw new SyncTransportException("empty pull response for " + request.operationId());
            return response;
        } catch (RestClientException e) {
            throw new SyncTransportException("pull from authority failed: " + e.getMessage(), e);
        }
    }
}
