package ai.pulse.model.remote;

import ai.pulse.model.StepKind;
import com.fasterxml.jackson.databind.JsonNode;

import java.util.Map;

/**
 * Remote analysis API as seen by the workflow engine.
 *
 * <p>Implementations report transport-level faults (connection errors, request timeouts) with
 * {@link ai.pulse.model.exceptions.TransportException} and non-success responses with
 * {@link ai.pulse.model.exceptions.RemoteFailureException} carrying the response status code.
 */
public interface AnalysisTransport {

    /**
     * Submits one analysis request.
     *
     * @param kind    analysis to run, selects the remote endpoint
     * @param options normalized options of the step
     * @param inputs  request inputs keyed by their request field name
     */
    SubmitResponse submit(StepKind kind, Map<String, Object> options, Map<String, JsonNode> inputs);

    JobStatusResponse pollStatus(String jobId);

    JsonNode fetchResult(String resultLocation);
}
