package com.kvrestore.core.retry;

import lombok.Getter;

/** Failure of a remote collaborator call, tagged with the error kind the service reported. */
@Getter
public class RemoteServiceException extends RuntimeException {

  private final ErrorKind kind;

  public RemoteServiceException(ErrorKind kind, String message) {
    super(message);
    this.kind = kind;
  }

  public RemoteServiceException(ErrorKind kind, String message, Throwable cause) {
    super(message, cause);
    this.kind = kind;
  }

  public static ErrorKind kindOf(Throwable error) {
    if (error instanceof RemoteServiceException remote) {
      return remote.getKind();
    }
    return ErrorKind.UNKNOWN;
  }

  @Override
  public String getMessage() {
    return kind + ": " + super.getMessage();
  }
}
