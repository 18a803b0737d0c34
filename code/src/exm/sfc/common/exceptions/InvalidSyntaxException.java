/*
 * Copyright 2013 University of Chicago and Argonne National Laboratory
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
 * limitations under the License
 */
package exm.sfc.common.exceptions;

import exm.sfc.ast.SourceLocation;

/**
 * Source text that the parser does not accept
 */
public class InvalidSyntaxException extends UserException {

  /**
   *
   */
  private static final long serialVersionUID = 6431900750823410921L;

  public InvalidSyntaxException(SourceLocation loc, String message) {
    super(loc, message);
  }

  public InvalidSyntaxException(String file, int line, int col,
                                String message) {
    super(file, line, col, message);
  }

}
