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

package com.act.xray.sql;

import org.apache.commons.cli.CommandLine;
import org.apache.commons.cli.Option;
import org.apache.commons.cli.ParseException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;
import java.util.Properties;

/**
 * A connection to the PostgreSQL copy of the X-ray database.  Tools open it from the {@code --db-*} options: either
 * a full JDBC url, or any of host, port and database name completed with the defaults.
 */
public class DB implements AutoCloseable {
  private static final Logger LOGGER = LogManager.getFormatterLogger(DB.class);

  public static final String DRIVER_CLASS = "org.postgresql.Driver";

  public static final String DEFAULT_HOST = "localhost";
  public static final int DEFAULT_PORT = 5432;
  public static final String DEFAULT_DB_NAME = "xraydata";

  public static final String DB_OPTION_URL = "db-url";
  public static final String DB_OPTION_HOST = "db-host";
  public static final String DB_OPTION_PORT = "db-port";
  public static final String DB_OPTION_USERNAME = "db-user";
  public static final String DB_OPTION_PASSWORD = "db-pass";
  public static final String DB_OPTION_DB_NAME = "db-name";

  public static final List<Option.Builder> DB_OPTION_BUILDERS = new ArrayList<Option.Builder>() {{
    add(Option.builder()
        .argName("jdbc url")
        .desc("The JDBC url of the X-ray database; cannot be combined with --db-host, --db-port or --db-name")
        .hasArg()
        .longOpt(DB_OPTION_URL)
    );
    add(Option.builder()
        .argName("host")
        .desc(String.format("The X-ray database host (default = %s)", DEFAULT_HOST))
        .hasArg()
        .longOpt(DB_OPTION_HOST)
    );
    add(Option.builder()
        .argName("port")
        .desc(String.format("The X-ray database port (default = %d)", DEFAULT_PORT))
        .hasArg()
        .longOpt(DB_OPTION_PORT)
    );
    add(Option.builder()
        .argName("name")
        .desc(String.format("The X-ray database name (default = %s)", DEFAULT_DB_NAME))
        .hasArg()
        .longOpt(DB_OPTION_DB_NAME)
    );
    add(Option.builder()
        .argName("user")
        .desc("The user to connect as")
        .hasArg()
        .longOpt(DB_OPTION_USERNAME)
    );
    add(Option.builder()
        .argName("password")
        .desc("The password of the database user")
        .hasArg()
        .longOpt(DB_OPTION_PASSWORD)
    );
  }};

  private final Connection conn;

  DB(Connection conn) {
    this.conn = conn;
  }

  public static DB connect(String url, String user, String password) throws ClassNotFoundException, SQLException {
    // A missing driver jar surfaces here as ClassNotFoundException.
    Class.forName(DRIVER_CLASS);
    Properties properties = new Properties();
    if (user != null) {
      properties.setProperty("user", user);
    }
    if (password != null) {
      properties.setProperty("password", password);
    }
    Connection conn = DriverManager.getConnection(url, properties);
    LOGGER.info("Connected to %s", url);
    return new DB(conn);
  }

  public static String makeUrl(String host, Integer port, String databaseName) {
    return String.format("jdbc:postgresql://%s:%d/%s",
        host == null ? DEFAULT_HOST : host,
        port == null ? DEFAULT_PORT : port,
        databaseName == null ? DEFAULT_DB_NAME : databaseName);
  }

  public static boolean hasDBOptions(CommandLine cl) {
    return cl.hasOption(DB_OPTION_URL) || cl.hasOption(DB_OPTION_HOST) || cl.hasOption(DB_OPTION_PORT) ||
        cl.hasOption(DB_OPTION_DB_NAME);
  }

  /**
   * @return the JDBC url described by the database options.
   * @throws ParseException if the port is not a TCP port number, or if a url is combined with its parts.
   */
  public static String urlFromCLI(CommandLine cl) throws ParseException {
    if (cl.hasOption(DB_OPTION_URL)) {
      if (cl.hasOption(DB_OPTION_HOST) || cl.hasOption(DB_OPTION_PORT) || cl.hasOption(DB_OPTION_DB_NAME)) {
        throw new ParseException(String.format("--%s cannot be combined with --%s, --%s or --%s",
            DB_OPTION_URL, DB_OPTION_HOST, DB_OPTION_PORT, DB_OPTION_DB_NAME));
      }
      return cl.getOptionValue(DB_OPTION_URL);
    }

    Integer port = null;
    String portValue = cl.getOptionValue(DB_OPTION_PORT);
    if (portValue != null) {
      try {
        port = Integer.parseInt(portValue.trim());
      } catch (NumberFormatException e) {
        throw new ParseException(String.format("--%s must be a number, got '%s'", DB_OPTION_PORT, portValue));
      }
      if (port < 1 || port > 65535) {
        throw new ParseException(String.format("--%s must be in [1, 65535], got %d", DB_OPTION_PORT, port));
      }
    }
    return makeUrl(cl.getOptionValue(DB_OPTION_HOST), port, cl.getOptionValue(DB_OPTION_DB_NAME));
  }

  public static DB openDBFromCLI(CommandLine cl) throws ParseException, ClassNotFoundException, SQLException {
    return connect(urlFromCLI(cl), cl.getOptionValue(DB_OPTION_USERNAME), cl.getOptionValue(DB_OPTION_PASSWORD));
  }

  public Connection getConn() {
    return conn;
  }

  @Override
  public void close() throws SQLException {
    if (!conn.isClosed()) {
      conn.close();
    }
  }
}
