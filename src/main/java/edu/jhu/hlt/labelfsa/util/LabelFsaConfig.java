// Copyright (c) 2013, Johns Hopkins University. All rights reserved.
// This software is released under the 2-clause BSD license.
// See /LICENSE.txt

package edu.jhu.hlt.labelfsa.util;

import java.io.File;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.Reader;
import java.util.Properties;
import java.util.logging.Logger;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import org.apache.commons.io.FileUtils;

import com.google.common.base.Charsets;

/**
 * A utility wrapper around {@code java.util.Properties}, supporting type specific querying
 * on property values.
 * <p>
 * System properties win over the properties file that was loaded into this object (so
 * command line specified properties can supersede a configuration file). The file is
 * named by the {@code config.filename} system property, or given to {@link #load(String)}.
 * <p>
 * Values may reference other properties, e.g.
 * <pre>
 * ROOT = /home/joe/project
 * labelfsa.output.dir = {ROOT}/graphs
 * </pre>
 */
public class LabelFsaConfig {

	// directory the command line tool writes DOT files into
	public final static String OUTPUT_DIR = "labelfsa.output.dir";
	// text drawn on blank edges in DOT output
	public final static String DOT_BLANK = "labelfsa.dot.blank";
	// worker threads for batch construction
	public final static String BATCH_THREADS = "labelfsa.batch.threads";

	public final static String CONFIG_FILENAME = "config.filename";

	private static final Logger logger = Logger.getLogger(LabelFsaConfig.class.getName());

	static Properties properties;
	static boolean isLoaded = false;
	static String propertiesFileName = null;

	static Pattern variablePattern = Pattern.compile("\\{[^\\\\}]+\\}");

	public static String getPropertiesFileName() {
		return propertiesFileName;
	}

	private static String parsePropertyValue(String value) {
		String group, replacement;
		Matcher m = variablePattern.matcher(value);
		StringBuffer sb = new StringBuffer();
		while (m.find()) {
			group = m.group();
			group = group.substring(1, group.length() - 1);
			replacement = lookup(group);
			if (replacement != null)
				m.appendReplacement(sb, Matcher.quoteReplacement(replacement));
			else {
				logger.warning("Cannot parse property [" + value + "], as [" + group + "] does not resolve");
				return null;
			}
		}
		m.appendTail(sb);
		return sb.toString();
	}

	private static String lookup(String key) {
		String value = System.getProperty(key);
		if (value == null && properties != null) value = properties.getProperty(key);
		return value;
	}

	private static void ensureLoaded() {
		if (isLoaded) return;
		try {
			load();
		} catch (IOException e) {
			throw new RuntimeException("cannot load configuration from " + System.getProperty(CONFIG_FILENAME), e);
		}
	}

	public static void load() throws IOException {
		String filename = System.getProperty(CONFIG_FILENAME);
		if (filename != null) {
			logger.info("Loading properties file: " + filename);
			load(filename);
		}
		isLoaded = true;
	}

	public static void load(String filename) throws IOException {
		logger.config("Reading LabelFsa property file [" + filename + "]");
		Properties loaded = new Properties();
		Reader reader = new InputStreamReader(FileUtils.openInputStream(new File(filename)), Charsets.UTF_8);
		try {
			loaded.load(reader);
		} finally {
			reader.close();
		}
		if (properties == null) properties = new Properties();
		properties.putAll(loaded);
		isLoaded = true;
		propertiesFileName = filename;
	}

	/**
	 * Forget everything loaded from files; system properties are unaffected.
	 */
	public static void reset() {
		properties = null;
		isLoaded = false;
		propertiesFileName = null;
	}

	public static String getString(String key, String defaultValue) {
		ensureLoaded();

		String value = lookup(key);
		if (value == null) {
			logger.config("Returning default value for " + key + " : " + defaultValue);
			return defaultValue;
		}
		if ((value = parsePropertyValue(value)) == null) {
			logger.config("Key not fully resolvable, returning default value for " + key + " : "
					+ defaultValue);
			return defaultValue;
		}
		return value;
	}

	public static String getString(String key) throws IOException {
		ensureLoaded();

		String value = lookup(key);
		if (value == null)
			throw new IOException("Key not found in property specification: [" + key + "]");
		if ((value = parsePropertyValue(value)) == null)
			throw new IOException("Key not resolvable in property specification: [" + key + "]");
		return value;
	}

	public static int getInt(String key, int defaultValue) {
		String value = getString(key, null);
		if (value == null)
			return defaultValue;
		try {
			return Integer.parseInt(value.trim());
		} catch (NumberFormatException e) {
			throw new IllegalArgumentException("Property [" + key + "] is not an integer: " + value, e);
		}
	}

	public static boolean getBoolean(String key, boolean defaultValue) {
		String value = getString(key, null);
		if (value == null)
			return defaultValue;
		return Boolean.valueOf(value.trim());
	}

	/**
	 * Directory named by {@code key}, or {@code defaultDirectory} when unset.
	 * The directory is not required to exist yet.
	 */
	public static File getDirectory(String key, File defaultDirectory) {
		String location = getString(key, null);
		if (location == null)
			return defaultDirectory;
		return new File(location);
	}
}
