package com.partnerbridge.bothub.registry;

import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import com.partnerbridge.bothub.schedule.ScheduleEngine;
import com.partnerbridge.bothub.tenant.TenantBot;
import com.partnerbridge.bothub.tenant.TenantConfigStore;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.boot.DefaultApplicationArguments;
import org.springframework.test.util.ReflectionTestUtils;

@ExtendWith(MockitoExtension.class)
class BotRegistryBootstrapperTest {

  @Mock private TenantConfigStore tenants;
  @Mock private BotRegistry registry;
  @Mock private ScheduleEngine engine;

  @InjectMocks private BotRegistryBootstrapper bootstrapper;

  @Test
  void registersActiveBotsThenStartsSchedules() {
    List<TenantBot> active =
        List.of(
            new TenantBot(7, "111111111:AAbb", "Shop", "tok-7", true),
            new TenantBot(8, "222222222:CCdd", "Depot", "tok-8", true));
    when(tenants.getActiveTenants()).thenReturn(active);
    when(registry.reconcileOnStartup(active)).thenReturn(1);
    ReflectionTestUtils.setField(bootstrapper, "enabled", true);

    bootstrapper.run(new DefaultApplicationArguments());

    verify(registry).reconcileOnStartup(active);
    verify(engine).start();
  }

  @Test
  void disabledBootstrapTouchesNothing() {
    ReflectionTestUtils.setField(bootstrapper, "enabled", false);

    bootstrapper.run(new DefaultApplicationArguments());

    verifyNoInteractions(tenants, registry, engine);
  }
}
