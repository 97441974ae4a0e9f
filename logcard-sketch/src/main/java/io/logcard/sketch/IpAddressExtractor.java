package io.logcard.sketch;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.CharsetDecoder;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Pulls IPv4 addresses out of a log file, one per line at most.
 */
public final class IpAddressExtractor
{
  private static final Logger LOG = LoggerFactory.getLogger(IpAddressExtractor.class);

  // octets are not range checked, "999.1.1.1" matches as well
  static final Pattern IP_PATTERN = Pattern.compile("\\b(?:\\d{1,3}\\.){3}\\d{1,3}\\b");

  private IpAddressExtractor()
  {
  }

  /**
   * @return the first address of every line that has one, in file order, duplicates included
   *
   * @throws IOException if the file can't be opened or read
   */
  public static List<String> extract(Path logFile) throws IOException
  {
    List<String> addresses = new ArrayList<>();
    long lines = 0;
    try (BufferedReader reader = newLenientReader(logFile)) {
      String line;
      while ((line = reader.readLine()) != null) {
        lines++;
        String address = firstAddress(line);
        if (address != null) {
          addresses.add(address);
        }
      }
    }
    LOG.info("Extracted {} addresses from {} lines of {}", addresses.size(), lines, logFile);
    return addresses;
  }

  /**
   * @return distinct addresses in order of first appearance
   */
  public static Set<String> distinct(Path logFile) throws IOException
  {
    return new LinkedHashSet<>(extract(logFile));
  }

  static String firstAddress(String line)
  {
    Matcher matcher = IP_PATTERN.matcher(line);
    return matcher.find() ? matcher.group() : null;
  }

  // malformed bytes are dropped instead of failing the whole file
  private static BufferedReader newLenientReader(Path file) throws IOException
  {
    CharsetDecoder decoder = StandardCharsets.UTF_8.newDecoder()
        .onMalformedInput(CodingErrorAction.IGNORE)
        .onUnmappableCharacter(CodingErrorAction.IGNORE);
    return new BufferedReader(new InputStreamReader(Files.newInputStream(file), decoder));
  }
}
