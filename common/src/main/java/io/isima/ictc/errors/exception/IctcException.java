/*
 * Copyright (C) 2025 Isima, Inc.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package io.isima.ictc.errors.exception;

import io.isima.ictc.errors.GenericError;
import io.isima.ictc.errors.IctcError;
import java.util.Objects;

/**
 * An exception thrown when a pipeline stage fails.
 *
 * <p>The exception carries an error code from one of the error catalogs and an optional context
 * object, e.g. the archive, feature or training round the failure is about, so that the failure can
 * be reproduced without rerunning the whole pipeline.
 */
public class IctcException extends Exception implements IctcError {

  private static final long serialVersionUID = 4187360095581290125L;

  protected final IctcError info;

  protected String mymessage;

  protected Object context;

  public IctcException(String message) {
    this.info = GenericError.APPLICATION_ERROR;
    mymessage = message;
  }

  public IctcException(String message, Throwable t) {
    super(t);
    this.info = GenericError.APPLICATION_ERROR;
    mymessage = message;
  }

  public IctcException(IctcError info) {
    Objects.requireNonNull(info, "'info' must not be null");
    mymessage = info.getErrorMessage();
    this.info = info;
  }

  public IctcException(IctcError info, String additionalMessage) {
    Objects.requireNonNull(info, "'info' must not be null");
    mymessage = info.getErrorMessage() + ": " + additionalMessage;
    this.info = info;
  }

  public IctcException(IctcError info, Throwable t) {
    super(t);
    Objects.requireNonNull(info, "'info' must not be null");
    mymessage = info.getErrorMessage();
    this.info = info;
  }

  public IctcException(IctcError info, String additionalMessage, Throwable t) {
    super(t);
    Objects.requireNonNull(info, "'info' must not be null");
    mymessage = info.getErrorMessage() + ": " + additionalMessage;
    this.info = info;
  }

  public IctcError getInfo() {
    return info;
  }

  public Object getContext() {
    return context;
  }

  public IctcException setContext(Object context) {
    this.context = context;
    return this;
  }

  @Override
  public String getErrorCode() {
    return info.getErrorCode();
  }

  public String getErrorName() {
    return info.toString();
  }

  @Override
  public String getMessage() {
    return mymessage;
  }

  @Override
  public String getErrorMessage() {
    return getMessage();
  }

  public void appendMessage(final String additional) {
    mymessage += "; " + additional;
  }

  @Override
  public String toString() {
    final var sb = new StringBuilder(getClass().getName());
    sb.append(": [").append(getErrorCode()).append("] ").append(mymessage);
    if (context != null) {
      sb.append(" (context=").append(context).append(")");
    }
    return sb.toString();
  }
}
