package com.partnerbridge.bothub.schedule;

import com.fasterxml.jackson.databind.SequenceWriter;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import com.partnerbridge.bothub.backoffice.BalanceEntry;
import com.partnerbridge.bothub.config.BotHubProperties;
import com.partnerbridge.bothub.events.PartnerTerminology;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.io.Writer;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Balance statement as a semicolon separated CSV, one row per entry, grouped by currency and
 * firm. Debit and credit headers are named from the partner's side.
 */
@Component
@Slf4j
public class CsvBalanceReportGenerator implements BalanceReportGenerator {

  static final String CURRENCY = "Валюта";
  static final String FIRM = "Предприятие";
  static final String DATE = "Дата";
  static final String DOCUMENT = "Документ";
  static final String DOCUMENT_TYPE = "Тип документа";
  static final String START = "Начальный остаток";
  static final String BALANCE = "Остаток";

  private static final DateTimeFormatter DATE_TIME =
      DateTimeFormatter.ofPattern("dd.MM.yyyy HH:mm");

  private final CsvMapper mapper = new CsvMapper();
  private final ZoneId zone;

  public CsvBalanceReportGenerator(BotHubProperties hub) {
    this.zone = hub.zoneId();
  }

  @Override
  public Path render(long partnerId, List<BalanceEntry> entries) {
    CsvSchema schema =
        CsvSchema.builder()
            .addColumn(CURRENCY)
            .addColumn(FIRM)
            .addColumn(DATE)
            .addColumn(DOCUMENT)
            .addColumn(DOCUMENT_TYPE)
            .addColumn(START)
            .addColumn(PartnerTerminology.debitLabel())
            .addColumn(PartnerTerminology.creditLabel())
            .addColumn(BALANCE)
            .setColumnSeparator(';')
            .setUseHeader(true)
            .build();

    List<BalanceEntry> sorted = new ArrayList<>(entries);
    sorted.sort(
        Comparator.comparing((BalanceEntry e) -> nullToEmpty(e.currencyName()))
            .thenComparing(e -> nullToEmpty(e.firmName()))
            .thenComparingLong(BalanceEntry::date));

    try {
      Path file = Files.createTempFile("partner-balance-" + partnerId + "-", ".csv");
      try (Writer out = Files.newBufferedWriter(file, StandardCharsets.UTF_8);
          SequenceWriter rows = mapper.writer(schema).writeValues(out)) {
        for (BalanceEntry e : sorted) {
          rows.write(row(e));
        }
      } catch (IOException | RuntimeException e) {
        Files.deleteIfExists(file);
        throw e;
      }
      log.debug(
          "Balance report for partner {} written to {} ({} rows)", partnerId, file, sorted.size());
      return file;
    } catch (IOException e) {
      throw new UncheckedIOException("cannot write balance report for partner " + partnerId, e);
    }
  }

  private Map<String, String> row(BalanceEntry e) {
    Map<String, String> row = new LinkedHashMap<>();
    row.put(CURRENCY, nullToEmpty(e.currencyName()));
    row.put(FIRM, nullToEmpty(e.firmName()));
    row.put(DATE, formatDate(e.date()));
    row.put(DOCUMENT, nullToEmpty(e.documentCode()));
    row.put(DOCUMENT_TYPE, nullToEmpty(e.documentType()));
    row.put(START, amount(e.startAmount()));
    row.put(PartnerTerminology.debitLabel(), amount(e.debit()));
    row.put(PartnerTerminology.creditLabel(), amount(e.credit()));
    row.put(BALANCE, amount(e.closingBalance()));
    return row;
  }

  private String formatDate(long epochSeconds) {
    if (epochSeconds <= 0) {
      return "";
    }
    return DATE_TIME.format(Instant.ofEpochSecond(epochSeconds).atZone(zone));
  }

  private static String amount(BigDecimal value) {
    return value.setScale(2, RoundingMode.HALF_UP).toPlainString();
  }

  private static String nullToEmpty(String s) {
    return s == null ? "" : s;
  }
}
