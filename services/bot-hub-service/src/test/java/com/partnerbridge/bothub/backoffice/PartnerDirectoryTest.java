package com.partnerbridge.bothub.backoffice;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.partnerbridge.bothub.client.BackOfficeClient;
import com.partnerbridge.bothub.client.BackOfficeResponse;
import com.partnerbridge.bothub.config.BackOfficeProperties;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class PartnerDirectoryTest {

  private static final String TOKEN = "tok-7";

  private final ObjectMapper json = new ObjectMapper();

  @Mock private BackOfficeClient client;

  private PartnerDirectory directory;

  @BeforeEach
  void setUp() {
    ChatIdProperty chatId = new ChatIdProperty(new BackOfficeProperties(null, null, null));
    directory = new PartnerDirectory(client, chatId);
  }

  private void partners(String resultJson) throws Exception {
    when(client.call(eq("Partner/Get"), any(), eq(TOKEN)))
        .thenReturn(new BackOfficeResponse(true, json.readTree(resultJson), null));
  }

  @Test
  void phoneMatchIgnoresFormatting() throws Exception {
    partners(
        "[{\"id\":1,\"name\":\"Other\",\"phones\":\"+998 (97) 111-22-33\"},"
            + "{\"id\":2,\"name\":\"Ali\",\"phones\":\"+998 (90) 123-45-67\"}]");

    assertThat(directory.findByPhone(TOKEN, "998901234567"))
        .get()
        .extracting(Partner::id, Partner::name)
        .containsExactly(2L, "Ali");
  }

  @Test
  void localNumberMatchesStoredInternationalNumber() throws Exception {
    partners("[{\"id\":2,\"name\":\"Ali\",\"phones\":\"998901234567\"}]");

    assertThat(directory.findByPhone(TOKEN, "901234567")).isPresent();
    assertThat(directory.findByPhone(TOKEN, "")).isEmpty();
  }

  @Test
  void shortStoredPhoneNeverMatchesAStranger() throws Exception {
    partners(
        "[{\"id\":1,\"name\":\"Junk\",\"phones\":\"998\"},"
            + "{\"id\":2,\"name\":\"Empty\",\"phones\":\"\"},"
            + "{\"id\":3,\"name\":\"Other\",\"phones\":\"+998 97 111 22 33\"}]");

    assertThat(directory.findByPhone(TOKEN, "+998 90 123 45 67")).isEmpty();
  }

  @Test
  void shortCallerNumberIsNotSearched() throws Exception {
    assertThat(directory.findByPhone(TOKEN, "12345")).isEmpty();
    verify(client, never()).call(any(), any(), any());
  }

  @Test
  void anyOfSeveralStoredPhonesMatches() throws Exception {
    partners("[{\"id\":5,\"name\":\"Ali\",\"phones\":\"+998 97 111 22 33, 90 123-45-67\"}]");

    assertThat(directory.findByPhone(TOKEN, "998901234567"))
        .get()
        .extracting(Partner::id)
        .isEqualTo(5L);
  }

  @Test
  void chatLinkedSkipsGarbageAndBlankIds() throws Exception {
    partners(
        "[{\"id\":1,\"oked\":\"555\"},{\"id\":2,\"oked\":\"\"},{\"id\":3,\"oked\":\"62.01\"},"
            + "{\"id\":0,\"oked\":\"777\"},{\"id\":4,\"oked\":777}]");

    assertThat(directory.listChatLinked(TOKEN)).extracting(Partner::id).containsExactly(1L, 4L);
    assertThat(directory.findByChatId(TOKEN, 777)).get().extracting(Partner::id).isEqualTo(4L);
  }

  @Test
  @SuppressWarnings("unchecked")
  void registerWritesChatIdIntoConfiguredProperty() throws Exception {
    when(client.call(eq("Partner/Add"), any(), eq(TOKEN)))
        .thenReturn(new BackOfficeResponse(true, json.readTree("{\"new_id\":99}"), null));

    assertThat(directory.register(TOKEN, new NewPartner(4, "Ali Valiev", "998901234567", 555)))
        .hasValue(99L);

    ArgumentCaptor<Object> body = ArgumentCaptor.forClass(Object.class);
    verify(client).call(eq("Partner/Add"), body.capture(), eq(TOKEN));
    assertThat((Map<String, Object>) body.getValue())
        .containsEntry("group_id", 4L)
        .containsEntry("name", "Ali Valiev")
        .containsEntry("phones", "998901234567")
        .containsEntry("oked", "555");
  }

  @Test
  void registerWithoutNewIdIsEmpty() throws Exception {
    when(client.call(eq("Partner/Add"), any(), eq(TOKEN)))
        .thenReturn(new BackOfficeResponse(true, json.readTree("{}"), null));

    assertThat(directory.register(TOKEN, new NewPartner(4, "Ali", "998", 555))).isEmpty();
  }

  @Test
  void linkChatReportsBackOfficeVerdict() {
    when(client.call(eq("Partner/Edit"), any(), eq(TOKEN)))
        .thenReturn(BackOfficeResponse.failed("locked"));

    assertThat(directory.linkChat(TOKEN, 2, 555)).isFalse();
  }
}
