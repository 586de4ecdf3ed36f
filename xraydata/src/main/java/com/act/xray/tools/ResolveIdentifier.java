/*************************************************************************
*                                                                        *
*  This file is part of the 20n/act project.                             *
*  20n/act enables DNA prediction for synthetic biology/bioengineering.  *
*  Copyright (C) 2017 20n Labs, Inc.                                     *
*                                                                        *
*  Please direct all queries to act@20n.com.                             *
*                                                                        *
*  This program is free software: you can redistribute it and/or modify  *
*  it under the terms of the GNU General Public License as published by  *
*  the Free Software Foundation, either version 3 of the License, or     *
*  (at your option) any later version.                                   *
*                                                                        *
*  This program is distributed in the hope that it will be useful,       *
*  but WITHOUT ANY WARRANTY; without even the implied warranty of        *
*  MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the         *
*  GNU General Public License for more details.                          *
*                                                                        *
*  You should have received a copy of the GNU General Public License     *
*  along with this program.  If not, see <http://www.gnu.org/licenses/>. *
*                                                                        *
*************************************************************************/

package com.act.xray.tools;

import com.act.xray.resolve.EntityKind;
import com.act.xray.resolve.ReferencePreferences;
import com.act.xray.resolve.ResolutionException;
import com.act.xray.resolve.Resolvers;
import com.act.xray.sql.DB;
import com.act.xray.sql.JdbcQueryExecutor;
import com.act.xray.sql.QueryExecutor;
import com.act.xray.sql.Schema;
import com.act.xray.sql.SelectBuilder;
import com.act.xray.sql.SqlQuery;
import org.apache.commons.cli.CommandLine;
import org.apache.commons.cli.Option;
import org.apache.commons.cli.ParseException;
import org.apache.commons.lang3.StringUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.File;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Prints the SQL selecting a property of an X-ray entity, and optionally runs it.
 */
public class ResolveIdentifier {
  private static final Logger LOGGER = LogManager.getFormatterLogger(ResolveIdentifier.class);

  public static final String OPTION_KIND = "k";
  public static final String OPTION_IDENTIFIER = "i";
  public static final String OPTION_PROPERTY = "p";
  public static final String OPTION_SELECT = "s";
  public static final String OPTION_REFERENCE = "r";
  public static final String OPTION_REFERENCE_DEFAULTS = "d";
  public static final String OPTION_EXECUTE = "e";
  public static final String OPTION_QUERY_TIMEOUT = "t";

  public static final String DEFAULT_SELECT = Schema.ID;

  // Property table and foreign key column used when only the kind is given.
  private static final Map<EntityKind, String> DEFAULT_PROPERTIES = new EnumMap<EntityKind, String>(EntityKind.class) {{
    put(EntityKind.ELEMENT, Schema.ELEMENT_SYMBOL);
    put(EntityKind.ATOMIC_SHELL, Schema.ATOMIC_SHELL_NOTATION);
    put(EntityKind.ATOMIC_SUBSHELL, Schema.ATOMIC_SUBSHELL_NOTATION);
    put(EntityKind.XRAY_TRANSITION, Schema.XRAY_TRANSITION_NOTATION);
    put(EntityKind.XRAY_TRANSITIONSET, Schema.XRAY_TRANSITIONSET_NOTATION);
  }};
  private static final Map<EntityKind, String> FOREIGN_KEYS = new EnumMap<EntityKind, String>(EntityKind.class) {{
    put(EntityKind.ELEMENT, Schema.ELEMENT_ID);
    put(EntityKind.ATOMIC_SHELL, Schema.ATOMIC_SHELL_ID);
    put(EntityKind.ATOMIC_SUBSHELL, Schema.ATOMIC_SUBSHELL_ID);
    put(EntityKind.XRAY_TRANSITION, Schema.XRAY_TRANSITION_ID);
    put(EntityKind.XRAY_TRANSITIONSET, Schema.XRAY_TRANSITIONSET_ID);
    put(EntityKind.NOTATION, Schema.NOTATION_ID);
    put(EntityKind.LANGUAGE, Schema.LANGUAGE_ID);
    put(EntityKind.REFERENCE, Schema.REFERENCE_ID);
  }};

  public static final String HELP_MESSAGE = StringUtils.join(new String[]{
      "Resolves an element, shell, subshell, transition or transition set identifier into a query on one of the ",
      "X-ray property tables and prints it.  Identifiers are names or notations (Fe, K, L3, Ka1), integers (26), ",
      "(n,l,2j) subshells (2,1,3), transitions (2,1,3->1,0,1) or ';'-separated transitions.  Transition sets ",
      "given as transitions, and --execute, need a database connection."
  }, "");

  public static final List<Option.Builder> OPTION_BUILDERS = new ArrayList<Option.Builder>() {{
    add(Option.builder(OPTION_KIND)
        .argName("kind")
        .desc(String.format("The kind of entity to resolve, one of %s", kindNames()))
        .hasArg()
        .longOpt("kind")
        .required()
    );
    add(Option.builder(OPTION_IDENTIFIER)
        .argName("identifier")
        .desc("The identifier to resolve")
        .hasArg()
        .longOpt("identifier")
        .required()
    );
    add(Option.builder(OPTION_PROPERTY)
        .argName("property table")
        .desc(String.format("The property table to query, one of %s (defaults to the notation or symbol table " +
            "of the entity kind)", Schema.PROPERTY_TABLES))
        .hasArg()
        .longOpt("property")
    );
    add(Option.builder(OPTION_SELECT)
        .argName("columns")
        .desc(String.format("Comma separated columns of the property table to select (default = %s)",
            DEFAULT_SELECT))
        .hasArg()
        .longOpt("select")
    );
    add(Option.builder(OPTION_REFERENCE)
        .argName("bibtex key")
        .desc("Only select values from this reference")
        .hasArg()
        .longOpt("reference")
    );
    add(Option.builder(OPTION_REFERENCE_DEFAULTS)
        .argName("json file")
        .desc("A JSON file mapping property tables to their default reference")
        .hasArg()
        .longOpt("reference-defaults")
    );
    add(Option.builder(OPTION_EXECUTE)
        .argName("execute")
        .desc("Run the query and print the result rows")
        .longOpt("execute")
    );
    add(Option.builder(OPTION_QUERY_TIMEOUT)
        .argName("seconds")
        .desc(String.format("Query timeout in seconds (default = %d)",
            JdbcQueryExecutor.DEFAULT_QUERY_TIMEOUT_SECONDS))
        .hasArg()
        .longOpt("query-timeout")
    );
    addAll(DB.DB_OPTION_BUILDERS);
  }};

  private final Resolvers resolvers;
  private final boolean filterOnReference;

  /**
   * @param filterOnReference whether to resolve a reference (possibly unspecified) on the property table.
   */
  public ResolveIdentifier(Resolvers resolvers, boolean filterOnReference) {
    this.resolvers = resolvers;
    this.filterOnReference = filterOnReference;
  }

  public static String kindNames() {
    List<String> names = new ArrayList<>();
    for (EntityKind kind : EntityKind.values()) {
      names.add(kindName(kind));
    }
    return StringUtils.join(names, ", ");
  }

  public static String kindName(EntityKind kind) {
    return kind.name().toLowerCase(Locale.ROOT).replace('_', '-');
  }

  public static EntityKind parseKind(String name) {
    for (EntityKind kind : EntityKind.values()) {
      if (kindName(kind).equalsIgnoreCase(name)) {
        return kind;
      }
    }
    return null;
  }

  public static String defaultProperty(EntityKind kind) {
    return DEFAULT_PROPERTIES.get(kind);
  }

  public SqlQuery buildQuery(EntityKind kind, Object identifier, String property, List<String> columns,
                             String reference) throws ResolutionException {
    SelectBuilder builder = new SelectBuilder();
    for (String column : columns) {
      builder.addSelect(property, column);
    }
    builder.addFrom(property);
    resolvers.resolve(kind, identifier, builder, property, FOREIGN_KEYS.get(kind));
    if (filterOnReference) {
      resolvers.resolve(EntityKind.REFERENCE, reference, builder, property, Schema.REFERENCE_ID);
    }
    return builder.build();
  }

  public static void main(String[] args) throws Exception {
    CLIUtil cliUtil = new CLIUtil(ResolveIdentifier.class, HELP_MESSAGE, OPTION_BUILDERS);
    CommandLine cl = cliUtil.parseCommandLine(args);

    EntityKind kind = parseKind(cl.getOptionValue(OPTION_KIND));
    if (kind == null) {
      cliUtil.failWithMessage("Unknown kind %s, expected one of %s", cl.getOptionValue(OPTION_KIND), kindNames());
      return;
    }

    String property;
    List<String> columns;
    int timeout;
    try {
      property = CLIUtil.getChoiceValue(cl, OPTION_PROPERTY, Schema.PROPERTY_TABLES, defaultProperty(kind));
      columns = CLIUtil.getListValue(cl, OPTION_SELECT, DEFAULT_SELECT);
      timeout = CLIUtil.getIntegerValue(cl, OPTION_QUERY_TIMEOUT, JdbcQueryExecutor.DEFAULT_QUERY_TIMEOUT_SECONDS, 0);
    } catch (ParseException e) {
      cliUtil.failWithMessage(e.getMessage());
      return;
    }
    if (property == null) {
      cliUtil.failWithMessage("A property table must be given when resolving a %s", kind.getDisplayName());
      return;
    }
    if (cl.hasOption(OPTION_EXECUTE) && !DB.hasDBOptions(cl)) {
      cliUtil.failWithMessage("--execute needs database connection options");
      return;
    }

    ReferencePreferences preferences = ReferencePreferences.NONE;
    if (cl.hasOption(OPTION_REFERENCE_DEFAULTS)) {
      preferences = ReferencePreferences.fromJsonFile(new File(cl.getOptionValue(OPTION_REFERENCE_DEFAULTS)));
    }
    boolean filterOnReference = cl.hasOption(OPTION_REFERENCE) || cl.hasOption(OPTION_REFERENCE_DEFAULTS);

    Object identifier = IdentifierParser.parse(kind, cl.getOptionValue(OPTION_IDENTIFIER));

    DB db;
    try {
      db = DB.hasDBOptions(cl) ? DB.openDBFromCLI(cl) : null;
    } catch (ParseException e) {
      cliUtil.failWithMessage(e.getMessage());
      return;
    }

    try (DB openDB = db) {
      QueryExecutor executor = openDB == null ? null : new JdbcQueryExecutor(openDB, timeout);
      ResolveIdentifier resolveIdentifier = new ResolveIdentifier(new Resolvers(executor, preferences),
          filterOnReference);

      SqlQuery query;
      try {
        query = resolveIdentifier.buildQuery(kind, identifier, property, columns, cl.getOptionValue(OPTION_REFERENCE));
      } catch (ResolutionException | IllegalArgumentException e) {
        LOGGER.error("Unable to resolve %s: %s", kind.getDisplayName(), e.getMessage());
        System.exit(1);
        return;
      }

      System.out.println(query.getSql());
      System.out.format("Parameters: %s\n", query.getParameters());

      if (cl.hasOption(OPTION_EXECUTE)) {
        List<List<Object>> rows = executor.executeQuery(query);
        for (List<Object> row : rows) {
          System.out.println(StringUtils.join(row, "\t"));
        }
        LOGGER.info("Query returned %d row(s)", rows.size());
      }
    }
  }
}
