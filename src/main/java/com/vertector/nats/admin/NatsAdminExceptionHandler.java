package com.vertector.nats.admin;

import io.nats.client.JetStreamApiException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

/** Maps admin endpoint failures onto {@link ApiError} bodies. */
@RestControllerAdvice(assignableTypes = NatsAdminController.class)
public class NatsAdminExceptionHandler {

	private static final Logger log = LoggerFactory.getLogger(NatsAdminExceptionHandler.class);

	@ExceptionHandler(IllegalArgumentException.class)
	public ResponseEntity<ApiError> badRequest(IllegalArgumentException e) {
		return ResponseEntity.badRequest().body(new ApiError("bad_request", e.getMessage()));
	}

	@ExceptionHandler(IllegalStateException.class)
	public ResponseEntity<ApiError> unavailable(IllegalStateException e) {
		return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE).body(new ApiError("unavailable", e.getMessage()));
	}

	@ExceptionHandler(JetStreamApiException.class)
	public ResponseEntity<ApiError> jetStream(JetStreamApiException e) {
		if (e.getErrorCode() == 404) {
			return ResponseEntity.status(HttpStatus.NOT_FOUND).body(new ApiError("not_found", e.getErrorDescription()));
		}
		log.warn("Admin JetStream request rejected code={} apiCode={}: {}", e.getErrorCode(), e.getApiErrorCode(),
				e.getErrorDescription());
		return ResponseEntity.status(HttpStatus.BAD_GATEWAY).body(new ApiError("jetstream_error", e.getErrorDescription()));
	}

	@ExceptionHandler(Exception.class)
	public ResponseEntity<ApiError> internal(Exception e) {
		// full detail stays in the server log
		log.error("Admin endpoint failure", e);
		return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(new ApiError("internal_error", "Request failed"));
	}

	public record ApiError(String code, String message) {
	}
}
