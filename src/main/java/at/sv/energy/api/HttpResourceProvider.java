package at.sv.energy.api;

import java.net.URL;
import java.time.Duration;

/**
 * Performs exactly one HTTP call per method invocation, bound to the given timeout. Bodies are sent as JSON.
 */
public interface HttpResourceProvider extends AutoCloseable {
    /**
     * @return the decoded response. Not null.
     * @throws DeviceTimeoutFailure     if the call did not complete within {@code timeout}
     * @throws DeviceConnectionFailure  if an IOException occurred, or the JSON body could not be parsed
     * @throws ApiDisabledFailure       if the response code is 403
     * @throws UnexpectedStatusFailure  if the response code is anything else than 200
     */
    RawResult getResource(URL url, Duration timeout);

    /**
     * @param body the json payload of the put request, or null to send an empty body
     * @return the decoded response. Not null.
     * @throws DeviceTimeoutFailure     if the call did not complete within {@code timeout}
     * @throws DeviceConnectionFailure  if an IOException occurred, or the JSON body could not be parsed
     * @throws ApiDisabledFailure       if the response code is 403
     * @throws UnexpectedStatusFailure  if the response code is anything else than 200
     */
    RawResult putResource(URL url, String body, Duration timeout);

    /**
     * @param body the json payload of the delete request
     * @return the decoded response. Not null.
     * @throws DeviceTimeoutFailure     if the call did not complete within {@code timeout}
     * @throws DeviceConnectionFailure  if an IOException occurred, or the JSON body could not be parsed
     * @throws ApiDisabledFailure       if the response code is 403
     * @throws UnexpectedStatusFailure  if the response code is anything else than 200
     */
    RawResult deleteResource(URL url, String body, Duration timeout);

    /**
     * Releases the underlying HTTP client, if it was created by this provider. Externally supplied clients stay open.
     */
    @Override
    default void close() {
    }
}
