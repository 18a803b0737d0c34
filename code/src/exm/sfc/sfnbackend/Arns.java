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
package exm.sfc.sfnbackend;

/**
 * Resource names for plan tasks.  Region and account are substituted
 * verbatim, so a placeholder account survives into the output.
 */
public class Arns {
  public static final String START_EXECUTION_SYNC =
                          "arn:aws:states:::states:startExecution.sync:2";

  public static String lambdaFunction(String region, String account,
                                      String function) {
    return "arn:aws:lambda:" + region + ":" + account + ":function:" +
           function;
  }

  public static String activity(String region, String account,
                                String activity) {
    return "arn:aws:states:" + region + ":" + account + ":activity:" +
           activity;
  }

  public static String stateMachine(String region, String account,
                                    String machine) {
    return "arn:aws:states:" + region + ":" + account + ":stateMachine:" +
           machine;
  }

  /**
   * Deployed name of a generated function unit
   * @param unitName
   * @return
   */
  public static String unitFunctionName(String unitName) {
    return unitName.replace('_', '-');
  }
}
