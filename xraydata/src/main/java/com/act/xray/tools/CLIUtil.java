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

import org.apache.commons.cli.CommandLine;
import org.apache.commons.cli.DefaultParser;
import org.apache.commons.cli.HelpFormatter;
import org.apache.commons.cli.Option;
import org.apache.commons.cli.Options;
import org.apache.commons.cli.ParseException;
import org.apache.commons.lang3.StringUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

/**
 * Command line handling for the X-ray tools: option parsing with a help flag, validated access to option values, and
 * exiting with the usage text on bad input.  The value accessors report bad values as {@link ParseException}s so
 * that tools handle them like unknown or missing options.
 */
public class CLIUtil {
  private static final Logger LOGGER = LogManager.getFormatterLogger(CLIUtil.class);

  public static final String OPTION_HELP = "help";

  public static final HelpFormatter HELP_FORMATTER = new HelpFormatter();
  static {
    HELP_FORMATTER.setWidth(100);
  }

  private final String commandName;
  private final String helpMessage;
  private final Options opts = new Options();

  public CLIUtil(Class<?> callingClass, String helpMessage, List<Option.Builder> optionBuilders) {
    this.commandName = callingClass.getCanonicalName();
    this.helpMessage = helpMessage;

    for (Option.Builder b : optionBuilders) {
      opts.addOption(b.build());
    }
    opts.addOption(Option.builder("h")
        .desc("Prints this help message")
        .longOpt(OPTION_HELP)
        .build());
  }

  public Options getOptions() {
    return opts;
  }

  public CommandLine parse(String[] args) throws ParseException {
    return new DefaultParser().parse(opts, args);
  }

  /**
   * Parses the arguments, printing the usage and exiting on a parse failure or when help is requested.
   */
  public CommandLine parseCommandLine(String[] args) {
    CommandLine cl;
    try {
      cl = parse(args);
    } catch (ParseException e) {
      LOGGER.error("Argument parsing failed: %s", e.getMessage());
      printHelp();
      System.exit(1);
      return null;
    }

    if (cl.hasOption(OPTION_HELP)) {
      printHelp();
      System.exit(0);
    }
    return cl;
  }

  /**
   * @return the option's value as an integer no smaller than {@code minimum}, or {@code defaultValue} when the option
   * is absent.
   */
  public static int getIntegerValue(CommandLine cl, String option, int defaultValue, int minimum)
      throws ParseException {
    String value = cl.getOptionValue(option);
    if (value == null) {
      return defaultValue;
    }

    int parsed;
    try {
      parsed = Integer.parseInt(value.trim());
    } catch (NumberFormatException e) {
      throw new ParseException(String.format("Option %s expects an integer, got '%s'", option, value));
    }
    if (parsed < minimum) {
      throw new ParseException(String.format("Option %s must be at least %d, got %d", option, minimum, parsed));
    }
    return parsed;
  }

  /**
   * @return the option's value, or {@code defaultValue} when the option is absent.
   * @throws ParseException if the value is not one of {@code choices}.
   */
  public static String getChoiceValue(CommandLine cl, String option, Collection<String> choices,
                                      String defaultValue) throws ParseException {
    String value = cl.getOptionValue(option, defaultValue);
    if (value != null && !choices.contains(value)) {
      throw new ParseException(String.format("Option %s must be one of %s, got '%s'",
          option, StringUtils.join(choices, ", "), value));
    }
    return value;
  }

  /**
   * @return the non-empty comma separated items of the option's value (or of {@code defaultValue}).
   * @throws ParseException if there are none.
   */
  public static List<String> getListValue(CommandLine cl, String option, String defaultValue) throws ParseException {
    String value = cl.getOptionValue(option, defaultValue);
    List<String> items = new ArrayList<>();
    if (value != null) {
      for (String item : StringUtils.split(value, ',')) {
        if (!item.trim().isEmpty()) {
          items.add(item.trim());
        }
      }
    }
    if (items.isEmpty()) {
      throw new ParseException(String.format("Option %s needs at least one value", option));
    }
    return items;
  }

  public void printHelp() {
    HELP_FORMATTER.printHelp(commandName, helpMessage, opts, null, true);
  }

  public void failWithMessage(String formatStr, Object... args) {
    failWithMessage(String.format(formatStr, args));
  }

  public void failWithMessage(String msg) {
    System.err.println(msg);
    printHelp();
    System.exit(1);
  }
}
