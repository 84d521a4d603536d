package com.nnstudio.orchestrator.client;

import com.nnstudio.orchestrator.client.dto.BatchSubmitRequest;
import com.nnstudio.orchestrator.client.dto.CancelResponse;
import com.nnstudio.orchestrator.client.dto.HealthResponse;
import com.nnstudio.orchestrator.client.dto.PollResponse;
import com.nnstudio.orchestrator.client.dto.ResultsResponse;
import com.nnstudio.orchestrator.client.dto.SubmitResponse;

/**
 * Asynchronous batch generation backend.
 *
 * Every method throws {@link RemoteCallException} on a non-2xx answer,
 * a transport failure, or a payload that does not match the contract.
 */
public interface BatchClient {

    SubmitResponse submit(BatchSubmitRequest request);

    PollResponse poll(String jobId);

    ResultsResponse results(String jobId);

    CancelResponse cancel(String jobId);

    HealthResponse health();
}
