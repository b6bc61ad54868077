package com.pourrice.chat.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.pourrice.chat.infrastructure.imagestore.DisabledImageStore;
import com.pourrice.chat.infrastructure.imagestore.OkHttpImageStoreClient;
import com.pourrice.chat.infrastructure.metrics.NoOpMetricsAdapter;
import com.pourrice.chat.infrastructure.transport.OkHttpChatTransport;
import java.util.HashMap;
import java.util.Map;
import okhttp3.OkHttpClient;
import org.junit.jupiter.api.Test;

class CompositionRootTest {

  @Test
  void defaultsUseNoOpMetricsAndDisabledImages() {
    CompositionRoot root = new CompositionRoot(ChatConfig.defaults());
    OkHttpClient client = new OkHttpClient();

    assertInstanceOf(NoOpMetricsAdapter.class, root.metrics());
    assertInstanceOf(DisabledImageStore.class, root.imageStore(client, root.tokenProvider()));
    assertInstanceOf(OkHttpChatTransport.class, root.transport(client));
    assertTrue(root.identityProvider().currentUser().isEmpty());
  }

  @Test
  void configuredValuesReachProviders() {
    Map<String, String> values = new HashMap<>(ChatDefaults.asFlatMap());
    values.put("userId", "diner-1");
    values.put("displayName", "Dana");
    values.put("authToken", "token-abc");
    values.put("apiBaseUrl", "https://api.pourrice.test");
    CompositionRoot root = new CompositionRoot(ChatConfig.fromMap(values));

    assertEquals("Dana", root.identityProvider().currentUser().orElseThrow().effectiveDisplayName());
    assertEquals("token-abc", root.tokenProvider().fetchToken().join());
    assertInstanceOf(OkHttpImageStoreClient.class, root.imageStore(new OkHttpClient(), root.tokenProvider()));
  }
}
