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
package io.isima.ictc;

import io.isima.ictc.common.IctcConfig;
import io.isima.ictc.errors.exception.IctcException;
import io.isima.ictc.study.StudyRunner;
import io.isima.ictc.train.BoostingBackend;
import io.isima.ictc.train.xgboost.XgboostBackend;
import java.nio.file.Paths;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Command line entry point.
 *
 * <p>Usage: {@code ictc <properties file>}. Exits with 0 when every window completed, 1 when a
 * window or an archive failed, and 2 when the study was halted.
 */
public class Ictc {
  private static final Logger logger = LoggerFactory.getLogger(Ictc.class);

  public static final int EXIT_COMPLETED = 0;
  public static final int EXIT_PARTIAL = 1;
  public static final int EXIT_HALTED = 2;

  public static void main(String[] args) {
    System.exit(run(args, new XgboostBackend()));
  }

  static int run(String[] args, BoostingBackend backend) {
    if (args.length != 1) {
      System.err.println("Usage: ictc <properties file>");
      return EXIT_HALTED;
    }
    try {
      final var config = IctcConfig.load(Paths.get(args[0]));
      final var result = new StudyRunner(config, backend).run();
      return result.isAllCompleted() ? EXIT_COMPLETED : EXIT_PARTIAL;
    } catch (IctcException e) {
      logger.error("Study halted: {}", e.toString(), e);
      return EXIT_HALTED;
    }
  }
}
