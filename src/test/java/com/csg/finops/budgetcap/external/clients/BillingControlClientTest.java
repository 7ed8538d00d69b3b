package com.csg.finops.budgetcap.external.clients;

import com.csg.finops.budgetcap.exception.BillingControlException;
import com.csg.finops.budgetcap.support.TestBudgetCapConfig;
import com.google.api.core.ApiFutures;
import com.google.api.core.SettableApiFuture;
import com.google.api.gax.rpc.UnaryCallable;
import com.google.cloud.billing.v1.CloudBillingClient;
import com.google.cloud.billing.v1.GetProjectBillingInfoRequest;
import com.google.cloud.billing.v1.ProjectBillingInfo;
import com.google.cloud.billing.v1.UpdateProjectBillingInfoRequest;
import io.smallrye.mutiny.helpers.test.UniAssertSubscriber;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Captor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class BillingControlClientTest {

    @Mock
    private CloudBillingClient cloudBillingClient;

    @Mock
    private UnaryCallable<GetProjectBillingInfoRequest, ProjectBillingInfo> getCallable;

    @Mock
    private UnaryCallable<UpdateProjectBillingInfoRequest, ProjectBillingInfo> updateCallable;

    @Captor
    private ArgumentCaptor<GetProjectBillingInfoRequest> getRequestCaptor;

    @Captor
    private ArgumentCaptor<UpdateProjectBillingInfoRequest> updateRequestCaptor;

    private BillingControlClient client;

    @BeforeEach
    void setUp() {
        client = new BillingControlClient(cloudBillingClient,
                new TestBudgetCapConfig("budget-notifications", Duration.ofMillis(200)));
    }

    @Test
    void testBillingEnabled() {
        givenBillingInfo(ProjectBillingInfo.newBuilder()
                .setName("projects/p1/billingInfo")
                .setBillingAccountName("billingAccounts/0X0X0X-0X0X0X-0X0X0X")
                .setBillingEnabled(true)
                .build());

        Boolean enabled = client.isBillingEnabled("p1")
                .subscribe().withSubscriber(UniAssertSubscriber.create())
                .awaitItem()
                .getItem();

        assertTrue(enabled);
        verify(getCallable).futureCall(getRequestCaptor.capture());
        assertEquals("projects/p1", getRequestCaptor.getValue().getName());
    }

    @Test
    void testBillingDisabled() {
        givenBillingInfo(ProjectBillingInfo.newBuilder().setName("projects/p2/billingInfo").build());

        Boolean enabled = client.isBillingEnabled("p2").await().indefinitely();

        assertFalse(enabled);
    }

    @Test
    void testReadFailureIsWrapped() {
        when(cloudBillingClient.getProjectBillingInfoCallable()).thenReturn(getCallable);
        when(getCallable.futureCall(any(GetProjectBillingInfoRequest.class)))
                .thenReturn(ApiFutures.immediateFailedFuture(new IllegalStateException("PERMISSION_DENIED")));

        UniAssertSubscriber<Boolean> subscriber = client.isBillingEnabled("p1")
                .subscribe().withSubscriber(UniAssertSubscriber.create())
                .awaitFailure();

        subscriber.assertFailedWith(BillingControlException.class);
        assertInstanceOf(IllegalStateException.class, subscriber.getFailure().getCause());
    }

    @Test
    void testReadTimesOut() {
        when(cloudBillingClient.getProjectBillingInfoCallable()).thenReturn(getCallable);
        SettableApiFuture<ProjectBillingInfo> read = SettableApiFuture.create();
        when(getCallable.futureCall(any(GetProjectBillingInfoRequest.class))).thenReturn(read);

        client.isBillingEnabled("p1")
                .subscribe().withSubscriber(UniAssertSubscriber.create())
                .awaitFailure(Duration.ofSeconds(5))
                .assertFailedWith(BillingControlException.class, "Timed out");

        assertTrue(read.isCancelled());
    }

    @Test
    void testDisableBillingUnlinksAccount() {
        givenUpdatedBillingInfo(ProjectBillingInfo.newBuilder()
                .setName("projects/p1/billingInfo")
                .setBillingAccountName("")
                .build());

        client.disableBilling("p1")
                .subscribe().withSubscriber(UniAssertSubscriber.create())
                .awaitItem()
                .assertCompleted();

        verify(updateCallable).futureCall(updateRequestCaptor.capture());
        UpdateProjectBillingInfoRequest request = updateRequestCaptor.getValue();
        assertEquals("projects/p1", request.getName());
        assertEquals("", request.getProjectBillingInfo().getBillingAccountName());
    }

    @Test
    void testDisableBillingFailsWhenAccountStillLinked() {
        givenUpdatedBillingInfo(ProjectBillingInfo.newBuilder()
                .setName("projects/p1/billingInfo")
                .setBillingAccountName("billingAccounts/0X0X0X-0X0X0X-0X0X0X")
                .build());

        client.disableBilling("p1")
                .subscribe().withSubscriber(UniAssertSubscriber.create())
                .awaitFailure()
                .assertFailedWith(BillingControlException.class, "still linked");
    }

    @Test
    void testDisableBillingTimesOutAndCancelsUpdate() {
        SettableApiFuture<ProjectBillingInfo> update = SettableApiFuture.create();
        when(cloudBillingClient.updateProjectBillingInfoCallable()).thenReturn(updateCallable);
        when(updateCallable.futureCall(any(UpdateProjectBillingInfoRequest.class))).thenReturn(update);

        client.disableBilling("p1")
                .subscribe().withSubscriber(UniAssertSubscriber.create())
                .awaitFailure(Duration.ofSeconds(5))
                .assertFailedWith(BillingControlException.class, "Timed out disabling billing");

        assertTrue(update.isCancelled());
    }

    @Test
    void testProjectResourceName() {
        assertEquals("projects/my-project", BillingControlClient.projectResourceName("my-project"));
    }

    private void givenBillingInfo(ProjectBillingInfo billingInfo) {
        when(cloudBillingClient.getProjectBillingInfoCallable()).thenReturn(getCallable);
        when(getCallable.futureCall(any(GetProjectBillingInfoRequest.class)))
                .thenReturn(ApiFutures.immediateFuture(billingInfo));
    }

    private void givenUpdatedBillingInfo(ProjectBillingInfo billingInfo) {
        when(cloudBillingClient.updateProjectBillingInfoCallable()).thenReturn(updateCallable);
        when(updateCallable.futureCall(any(UpdateProjectBillingInfoRequest.class)))
                .thenReturn(ApiFutures.immediateFuture(billingInfo));
    }
}
