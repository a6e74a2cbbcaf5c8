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

package exm.pylower.ui;

import java.io.PrintStream;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import org.apache.log4j.Logger;

import exm.pylower.ast.CstLeaf;
import exm.pylower.common.exceptions.InvalidSyntaxException;
import exm.pylower.common.exceptions.PyLowerFatal;
import exm.pylower.common.exceptions.UserException;
import exm.pylower.common.lang.TargetVersion;
import exm.pylower.frontend.CstWalker;
import exm.pylower.frontend.LoweringContext;
import exm.pylower.frontend.ParsedModule;
import exm.pylower.frontend.tree.Literals;
import exm.pylower.pyast.AstDump;
import exm.pylower.pyast.Module;
import exm.pylower.pyast.TypeIgnore;

/**
 * This is the main entry point for lowering source text
 */
public class PyLower {

  public static final String DEFAULT_FILENAME = "<unknown>";

  /** Text after "ignore" is the tag, e.g. "[attr-defined]" */
  private static final Pattern TYPE_IGNORE =
        Pattern.compile("^#\\s*type:\\s*ignore(?![A-Za-z0-9_])(.*)$");

  private final Logger logger;
  private final boolean typeComments;
  private final CstWalker walker;

  /**
   * @param typeComments if true, collect "# type: ignore" comments
   */
  public PyLower(Logger logger, boolean typeComments) {
    this.logger = logger;
    this.typeComments = typeComments;
    this.walker = new CstWalker(new Literals());
  }

  public Module lower(String sourceText, TargetVersion version)
                                             throws UserException {
    return lower(DEFAULT_FILENAME, sourceText, version);
  }

  /**
   * Parse and lower a whole file
   * @param inputFile name used in error messages
   * @throws InvalidSyntaxException if the text does not parse
   * @throws UserException if the text uses syntax the target version lacks
   */
  public Module lower(String inputFile, String sourceText,
                      TargetVersion version) throws UserException {
    logger.debug("Lowering " + inputFile + " for Python " + version);
    ParsedModule parsed = ParsedModule.parse(inputFile, sourceText,
                                             version);
    LoweringContext context = new LoweringContext(inputFile, version);
    Module module = walker.lowerModule(context, parsed.tree);
    if (typeComments) {
      module = module.withTypeIgnores(typeIgnores(parsed.comments));
    }
    return module;
  }

  static List<TypeIgnore> typeIgnores(List<CstLeaf> comments) {
    List<TypeIgnore> result = new ArrayList<TypeIgnore>();
    for (CstLeaf comment: comments) {
      Matcher m = TYPE_IGNORE.matcher(comment.text());
      if (m.matches()) {
        result.add(new TypeIgnore(comment.line(), m.group(1)));
      }
    }
    return result;
  }

  /**
   * Lower and print the dump of the result.  Errors are reported on
   * stderr and turned into a PyLowerFatal with the exit code.
   */
  public void run(String inputFile, String sourceText, TargetVersion version,
                  AstDump dump, PrintStream output) {
    try {
      Module module = lower(inputFile, sourceText, version);
      output.println(dump.dump(module));
      output.flush();
    } catch (InvalidSyntaxException e) {
      System.err.println("pylower syntax error:");
      System.err.println(e.getMessage());
      throw new PyLowerFatal(ExitCode.ERROR_PARSER.code());
    } catch (UserException e) {
      System.err.println("pylower error:");
      System.err.println(e.getMessage());
      if (logger.isDebugEnabled()) {
        logger.debug("Lowering failed", e);
      }
      throw new PyLowerFatal(ExitCode.ERROR_USER.code());
    } catch (PyLowerFatal e) {
      throw e;
    } catch (AssertionError e) {
      reportInternalError(logger, e);
      throw new PyLowerFatal(ExitCode.ERROR_INTERNAL.code());
    } catch (RuntimeException e) {
      // Includes trees with no lowering or missing children
      reportInternalError(logger, e);
      throw new PyLowerFatal(ExitCode.ERROR_INTERNAL.code());
    }
  }

  public static void reportInternalError(Logger logger, Throwable e) {
    logger.error("internal error", e);
    System.err.println("PYLOWER INTERNAL ERROR");
    System.err.println("Please report this");
    e.printStackTrace();
  }
}
