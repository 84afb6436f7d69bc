package com.scholary.djset.api;

import com.fasterxml.jackson.annotation.JsonInclude;

/** Body of every 4xx/5xx response. {@code details} is omitted when there is nothing to add. */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ErrorResponse(String error, String details) {

  public static ErrorResponse of(String error) {
    return new ErrorResponse(error, null);
  }
}
