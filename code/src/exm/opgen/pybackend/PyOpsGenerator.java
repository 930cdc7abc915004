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
package exm.opgen.pybackend;

import java.io.IOException;
import java.io.OutputStream;
import java.io.OutputStreamWriter;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.apache.log4j.Logger;

import exm.opgen.common.Logging;
import exm.opgen.common.Settings;
import exm.opgen.common.exceptions.GenerationException;
import exm.opgen.common.exceptions.InvalidOptionException;
import exm.opgen.common.exceptions.UnsupportedAttrTypeException;
import exm.opgen.common.lang.ApiDef;
import exm.opgen.common.lang.OpDef;
import exm.opgen.common.lang.Visibility;
import exm.opgen.pybackend.tree.Comment;
import exm.opgen.pybackend.tree.Line;
import exm.opgen.pybackend.tree.PyTree;
import exm.opgen.pybackend.tree.Sequence;

/**
 * Generates a python module with wrappers for a list of ops.
 * Ops are emitted in input order; an op that can't be generated is
 * replaced by a comment and the rest of the module is unaffected.
 */
public class PyOpsGenerator {

  private static final Logger logger = Logging.getLogger();

  /** Ops to generate as hidden, regardless of overrides */
  private final Set<String> hiddenOps;
  /** Ops whose wrappers get type annotations */
  private final Set<String> annotateOps;
  private final List<String> sourceFiles;

  public PyOpsGenerator(Collection<String> hiddenOps,
        Collection<String> annotateOps, List<String> sourceFiles) {
    this.hiddenOps = new HashSet<String>(hiddenOps);
    this.annotateOps = new HashSet<String>(annotateOps);
    this.sourceFiles = new ArrayList<String>(sourceFiles);
  }

  public PyOpsGenerator() {
    this(Collections.<String>emptyList(), Collections.<String>emptyList(),
         Collections.<String>emptyList());
  }

  /**
   * Create generator with options from settings, and apply formatting
   * settings to the code tree.
   */
  public static PyOpsGenerator fromSettings() throws InvalidOptionException {
    PyTree.configure(Settings.getInt(Settings.INDENT_WIDTH),
                     Settings.getInt(Settings.RIGHT_MARGIN));
    return new PyOpsGenerator(Settings.getList(Settings.HIDDEN_OPS),
                              Settings.getList(Settings.TYPE_ANNOTATE_OPS),
                              Settings.getList(Settings.SOURCE_FILES));
  }

  /**
   * @param apiDefs op name -> override.  Ops without an entry use the
   *        identity override.
   */
  public String generate(List<OpDef> ops, Map<String, ApiDef> apiDefs) {
    StringBuilder sb = new StringBuilder();
    sb.append(PyRuntime.header(sourceFiles));
    sb.append("\n");

    Set<String> usedNames = new HashSet<String>();
    int generated = 0;
    for (OpDef op: ops) {
      ApiDef api = apiDefs.get(op.name());
      if (api == null) {
        api = ApiDef.defaultFor(op);
      }
      Sequence block = generateOp(op, api, usedNames);
      if (block != null) {
        block.appendTo(sb);
        generated++;
      }
    }
    logger.debug("Generated " + generated + " of " + ops.size() + " ops");
    return sb.toString();
  }

  public void generate(List<OpDef> ops, Map<String, ApiDef> apiDefs,
                       OutputStream out) throws IOException {
    Writer w = new OutputStreamWriter(out, StandardCharsets.UTF_8);
    w.write(generate(ops, apiDefs));
    w.flush();
  }

  /**
   * @return code for op, or null if nothing is generated for it
   */
  private Sequence generateOp(OpDef op, ApiDef api, Set<String> usedNames) {
    if (api.visibility() == Visibility.SKIP) {
      logger.debug("Skipping op " + op.name());
      return null;
    }
    String fn = functionName(op, api, hiddenOps);
    if (usedNames.contains(fn) ||
        usedNames.contains(PyNamer.fallbackFunctionName(fn))) {
      Logging.uniqueWarn("Dropping op " + op.name() + ": function " + fn +
                         " is already defined");
      return null;
    }
    logger.debug("Generating op " + op.name() + " as " + fn);
    try {
      OpContext ctx = OpContext.build(op, api, fn,
                                      annotateOps.contains(op.name()));
      return OpEmitter.emit(ctx, usedNames);
    } catch (UnsupportedAttrTypeException e) {
      logger.warn("Not generating op " + op.name() + ": " + e.getMessage());
      return noDefinition(fn + " since we don't support attrs with type\n" +
                          "'" + e.attrType() + "' right now.");
    } catch (GenerationException e) {
      logger.warn("Not generating op " + op.name() + ": " + e.getMessage());
      return noDefinition(fn + ": " + e.getMessage());
    }
  }

  private static Sequence noDefinition(String text) {
    Sequence result = new Sequence();
    result.add(new Comment("No definition for " + text));
    result.add(Line.BLANK);
    return result;
  }

  /**
   * Python function name for op.  Hidden ops get a leading underscore
   * unless hidden only by their override; so do reserved words and a
   * few historical exceptions.
   */
  public static String functionName(OpDef op, ApiDef api,
                                    Set<String> hiddenOps) {
    String fn = PyNamer.lowerCaseOpName(op.name());
    boolean hiddenByApi = api.visibility() == Visibility.HIDDEN;
    boolean hidden = hiddenByApi || hiddenOps.contains(op.name());
    boolean reserved = PyNamer.isReserved(fn);
    if (hidden) {
      if (!hiddenByApi || reserved || PyNamer.isUnderscorePrefixOp(fn)) {
        return "_" + fn;
      }
    } else if (reserved) {
      Logging.uniqueWarn("Op " + op.name() + " maps to reserved name " + fn +
                         ", generating as _" + fn);
      return "_" + fn;
    }
    return fn;
  }
}
