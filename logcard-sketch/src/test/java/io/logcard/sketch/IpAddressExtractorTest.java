package io.logcard.sketch;

import com.google.common.collect.ImmutableList;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;

public class IpAddressExtractorTest
{
  @TempDir
  Path tempDir;

  static Path writeLog(Path dir) throws IOException
  {
    ByteArrayOutputStream bytes = new ByteArrayOutputStream();
    bytes.writeBytes((
        "192.168.0.1 - - [12/Mar/2024:10:00:00 +0000] \"GET / HTTP/1.1\" 200 512\n"
        + "no address on this line\n"
        + "10.0.0.1 forwarded for 10.0.0.2\n"
        + "192.168.0.1 - - [12/Mar/2024:10:00:01 +0000] \"GET /favicon.ico HTTP/1.1\" 404 0\n"
    ).getBytes(StandardCharsets.UTF_8));
    // not valid UTF-8
    bytes.write(0xFF);
    bytes.write(0xFE);
    bytes.writeBytes(" 172.16.0.5 ok\n".getBytes(StandardCharsets.UTF_8));

    Path log = dir.resolve("access.log");
    Files.write(log, bytes.toByteArray());
    return log;
  }

  @Test
  public void testExtractsFirstAddressPerLine() throws IOException
  {
    List<String> addresses = IpAddressExtractor.extract(writeLog(tempDir));
    assertEquals(ImmutableList.of("192.168.0.1", "10.0.0.1", "192.168.0.1", "172.16.0.5"), addresses);
  }

  @Test
  public void testDistinctKeepsFirstAppearanceOrder() throws IOException
  {
    Set<String> addresses = IpAddressExtractor.distinct(writeLog(tempDir));
    assertEquals(ImmutableList.of("192.168.0.1", "10.0.0.1", "172.16.0.5"), ImmutableList.copyOf(addresses));
  }

  @Test
  public void testFirstAddress()
  {
    assertEquals("8.8.8.8", IpAddressExtractor.firstAddress("dns=8.8.8.8;"));
    assertNull(IpAddressExtractor.firstAddress("version 1.2.3"));
    assertNull(IpAddressExtractor.firstAddress(""));
  }

  @Test
  public void testMissingFile()
  {
    assertThrows(IOException.class, () -> IpAddressExtractor.extract(tempDir.resolve("missing.log")));
  }
}
