package com.evstation.telemetry.ingestion.store;

import java.util.Set;

import org.springframework.stereotype.Component;

import lombok.extern.slf4j.Slf4j;
import software.amazon.awssdk.awscore.exception.AwsServiceException;
import software.amazon.awssdk.core.exception.SdkServiceException;
import software.amazon.awssdk.services.dynamodb.model.ProvisionedThroughputExceededException;
import software.amazon.awssdk.services.dynamodb.model.RequestLimitExceededException;

/**
 * Classifies AWS SDK exceptions raised by DynamoDB and S3 writes into store failure kinds.
 *
 * <p>Classification Logic:
 *
 * <ol>
 *   <li>Capacity Exceeded: DynamoDB throughput and request limits, HTTP 429, and throttling error
 *       codes such as S3 {@code SlowDown}
 *   <li>Transient Unavailable: everything else, including SDK call timeouts, connection failures
 *       and 5xx responses
 * </ol>
 *
 * <p>Non-retryable service errors (missing table, access denied) are also reported as transient:
 * the pipeline has exactly two failure kinds and neither triggers a retry in the core.
 */
@Slf4j
@Component
public class StoreExceptionClassifier {

  private static final int HTTP_TOO_MANY_REQUESTS = 429;

  private static final Set<String> THROTTLING_ERROR_CODES =
      Set.of(
          "ProvisionedThroughputExceededException",
          "RequestLimitExceeded",
          "ThrottlingException",
          "Throttling",
          "TooManyRequestsException",
          "SlowDown",
          "RequestThrottled");

  public StoreFailureKind classify(Throwable exception) {
    if (exception == null) {
      return StoreFailureKind.TRANSIENT_UNAVAILABLE;
    }

    if (exception instanceof ProvisionedThroughputExceededException
        || exception instanceof RequestLimitExceededException) {
      log.debug("Classified as CAPACITY_EXCEEDED: {}", exception.getMessage());
      return StoreFailureKind.CAPACITY_EXCEEDED;
    }

    if (exception instanceof SdkServiceException serviceException
        && (serviceException.isThrottlingException()
            || serviceException.statusCode() == HTTP_TOO_MANY_REQUESTS)) {
      log.debug("Classified as CAPACITY_EXCEEDED (throttled): {}", exception.getMessage());
      return StoreFailureKind.CAPACITY_EXCEEDED;
    }

    if (exception instanceof AwsServiceException awsException
        && awsException.awsErrorDetails() != null
        && THROTTLING_ERROR_CODES.contains(awsException.awsErrorDetails().errorCode())) {
      log.debug(
          "Classified as CAPACITY_EXCEEDED by error code {}",
          awsException.awsErrorDetails().errorCode());
      return StoreFailureKind.CAPACITY_EXCEEDED;
    }

    log.debug(
        "Classified as TRANSIENT_UNAVAILABLE: {} - {}",
        exception.getClass().getSimpleName(),
        exception.getMessage());
    return StoreFailureKind.TRANSIENT_UNAVAILABLE;
  }
}
