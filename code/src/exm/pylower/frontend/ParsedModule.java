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

package exm.pylower.frontend;

import java.util.ArrayList;
import java.util.List;

import org.antlr.runtime.ANTLRStringStream;
import org.antlr.runtime.CommonTokenStream;
import org.antlr.runtime.RecognitionException;
import org.antlr.runtime.Token;
import org.apache.log4j.Logger;

import com.google.common.collect.ImmutableList;

import exm.pylower.ast.CstLeaf;
import exm.pylower.ast.CstNode;
import exm.pylower.ast.TokenKind;
import exm.pylower.ast.antlr.PyLexer;
import exm.pylower.ast.antlr.PyParser;
import exm.pylower.common.Logging;
import exm.pylower.common.exceptions.InvalidSyntaxException;
import exm.pylower.common.exceptions.PyLowerRuntimeError;
import exm.pylower.common.lang.Feature;
import exm.pylower.common.lang.TargetVersion;
import exm.pylower.common.lang.VersionGate;

/**
 * Represents a parsed source file: its parse tree and its comments
 */
public class ParsedModule {

  private static final Logger logger = Logging.getPyLowerLogger();

  public final String inputFile;
  public final CstNode tree;
  /** Comments in source order, which the parse tree omits */
  public final ImmutableList<CstLeaf> comments;

  public ParsedModule(String inputFile, CstNode tree, List<CstLeaf> comments) {
    this.inputFile = inputFile;
    this.tree = tree;
    this.comments = ImmutableList.copyOf(comments);
  }

  /**
   * Parse source text into a concrete syntax tree
   * @param inputFile name used in error messages
   * @param version target version: before 3.7 "async" and "await" are
   *                names
   * @throws InvalidSyntaxException if the source does not match the grammar
   */
  public static ParsedModule parse(String inputFile, String sourceText,
                TargetVersion version) throws InvalidSyntaxException {
    String text = sourceText.replace("\r\n", "\n").replace('\r', '\n');
    ANTLRStringStream input = new ANTLRStringStream(text);
    input.name = inputFile;

    PyLexer lexer = new PyLexer(input);
    lexer.asyncKeywords = VersionGate.isSupported(Feature.ASYNC_KEYWORDS,
                                                  version);
    CommonTokenStream tokens = new CommonTokenStream(lexer);
    PyParser parser = new PyParser(tokens);

    CstNode tree;
    try {
      tree = (CstNode)parser.file_input();
    } catch (RecognitionException e) {
      throw new InvalidSyntaxException(inputFile, e.line,
                  e.charPositionInLine, "could not parse input");
    }

    /* The lexer and parser recover from errors and carry on, so check
     * whether either reported one */
    if (lexer.lexerError) {
      throw new InvalidSyntaxException(inputFile, lexer.firstErrorLine,
          lexer.firstErrorColumn, lexer.firstErrorMessage);
    }
    if (parser.parserError) {
      throw new InvalidSyntaxException(inputFile, parser.firstErrorLine,
          parser.firstErrorColumn, parser.firstErrorMessage);
    }
    if (tree == null) {
      throw new PyLowerRuntimeError("Parser produced no tree for " +
                                    inputFile);
    }

    tokens.fill();
    List<CstLeaf> comments = new ArrayList<CstLeaf>();
    for (Token t: tokens.getTokens()) {
      if (t.getType() == PyLexer.COMMENT) {
        comments.add(new CstLeaf(TokenKind.COMMENT, t.getText(), t.getLine(),
                                 t.getCharPositionInLine()));
      }
    }
    logger.debug("Parsed " + inputFile + ": " + tokens.size() + " tokens, " +
                 comments.size() + " comments");
    return new ParsedModule(inputFile, tree, comments);
  }
}
