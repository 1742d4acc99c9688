/*
 * Licensed to the Apache Software Foundation (ASF) under one or more
 * contributor license agreements.  See the NOTICE file distributed with
 * this work for additional information regarding copyright ownership.
 * The ASF licenses this file to You under the Apache License, Version 2.0
 * (the "License"); you may not use this file except in compliance with
 * the License.  You may obtain a copy of the License at
 *
 *    http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package org.sparkbridge;

/**
 * Base class of the exceptions raised by the bridge. All of them are unchecked and are
 * propagated to the immediate caller; nothing in the bridge retries an operation that
 * failed with one of these.
 */
public class BridgeException extends RuntimeException implements BridgeThrowable {

  private final String errorClass;
  private final String[] messageParameters;

  public BridgeException(String errorClass, String message, Throwable cause,
      String... messageParameters) {
    super(message, cause);
    this.errorClass = errorClass;
    this.messageParameters = messageParameters;
  }

  public BridgeException(String errorClass, String message) {
    this(errorClass, message, null);
  }

  @Override
  public String getErrorClass() {
    return errorClass;
  }

  @Override
  public String[] getMessageParameters() {
    return messageParameters.clone();
  }

  @Override
  public String getMessage() {
    return "[" + errorClass + "] " + super.getMessage();
  }
}
