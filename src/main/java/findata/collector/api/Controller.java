package findata.collector.api;

import com.fasterxml.jackson.core.JsonProcessingException;
import findata.collector.util.Json;
import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.HttpMethod;
import io.netty.handler.codec.http.HttpResponseStatus;

import java.util.Map;

/**
 * Base interface for HTTP controllers.
 * Controllers handle specific URL patterns and HTTP methods.
 */
public interface Controller {

    /**
     * Check if this controller can handle the given request.
     *
     * @param method HTTP method
     * @param path   Request path (without query string)
     * @return true if this controller handles this request
     */
    boolean matches(HttpMethod method, String path);

    /**
     * Handle the request.
     *
     * @param ctx  Netty channel context
     * @param req  Full HTTP request
     * @param path Request path (without query string)
     * @return Response to send back
     */
    ControllerResponse handle(ChannelHandlerContext ctx, FullHttpRequest req, String path);

    /**
     * Response from a controller.
     */
    record ControllerResponse(
            HttpResponseStatus status,
            String contentType,
            String body) {

        public static ControllerResponse json(HttpResponseStatus status, String body) {
            return new ControllerResponse(status, "application/json", body);
        }

        /** Serialize {@code value} with the shared mapper. */
        public static ControllerResponse json(HttpResponseStatus status, Object value) throws JsonProcessingException {
            return json(status, Json.mapper().writeValueAsString(value));
        }

        public static ControllerResponse error(HttpResponseStatus status, String message) {
            try {
                return json(status, Json.mapper().writeValueAsString(Map.of("error", message == null ? "" : message)));
            } catch (JsonProcessingException e) {
                return json(status, "{\"error\":\"unrepresentable error\"}");
            }
        }

        public static ControllerResponse notFound(String message) {
            return error(HttpResponseStatus.NOT_FOUND, message);
        }

        public static ControllerResponse badRequest(String message) {
            return error(HttpResponseStatus.BAD_REQUEST, message);
        }

        public static ControllerResponse badGateway(String message) {
            return error(HttpResponseStatus.BAD_GATEWAY, message);
        }

        public static ControllerResponse internalError(String message) {
            return error(HttpResponseStatus.INTERNAL_SERVER_ERROR, message);
        }
    }
}
