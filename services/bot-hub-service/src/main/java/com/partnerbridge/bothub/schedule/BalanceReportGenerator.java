package com.partnerbridge.bothub.schedule;

import com.partnerbridge.bothub.backoffice.BalanceEntry;
import java.nio.file.Path;
import java.util.List;

/** Renders a partner's balance statement into a file the caller owns and must delete. */
public interface BalanceReportGenerator {

  /**
   * @throws java.io.UncheckedIOException when the file cannot be written
   */
  Path render(long partnerId, List<BalanceEntry> entries);
}
