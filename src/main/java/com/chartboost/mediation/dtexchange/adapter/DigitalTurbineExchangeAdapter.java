package com.chartboost.mediation.dtexchange.adapter;

import com.chartboost.mediation.dtexchange.exception.MediationAdException;
import com.chartboost.mediation.dtexchange.exchange.AdRequest;
import com.chartboost.mediation.dtexchange.exchange.AdSpot;
import com.chartboost.mediation.dtexchange.exchange.BannerUnitController;
import com.chartboost.mediation.dtexchange.exchange.ExchangeSdk;
import com.chartboost.mediation.dtexchange.exchange.FullscreenUnitController;
import com.chartboost.mediation.dtexchange.exchange.InitStatus;
import com.chartboost.mediation.dtexchange.exchange.UnitController;
import com.chartboost.mediation.dtexchange.execution.CompletionBridge;
import com.chartboost.mediation.dtexchange.json.DecodeException;
import com.chartboost.mediation.dtexchange.json.JacksonMapper;
import com.chartboost.mediation.dtexchange.log.PartnerAdapterEvent;
import com.chartboost.mediation.dtexchange.log.PartnerLogController;
import com.chartboost.mediation.dtexchange.partner.PartnerAdListener;
import com.chartboost.mediation.dtexchange.partner.PartnerAdapter;
import com.chartboost.mediation.dtexchange.partner.model.ConsentKeys;
import com.chartboost.mediation.dtexchange.partner.model.ConsentValues;
import com.chartboost.mediation.dtexchange.partner.model.GdprConsentStatus;
import com.chartboost.mediation.dtexchange.partner.model.HostActivity;
import com.chartboost.mediation.dtexchange.partner.model.HostContext;
import com.chartboost.mediation.dtexchange.partner.model.MediationError;
import com.chartboost.mediation.dtexchange.partner.model.PartnerAd;
import com.chartboost.mediation.dtexchange.partner.model.PartnerAdFormat;
import com.chartboost.mediation.dtexchange.partner.model.PartnerAdLoadRequest;
import com.chartboost.mediation.dtexchange.partner.model.PartnerAdPreBidRequest;
import com.chartboost.mediation.dtexchange.partner.model.PartnerConfiguration;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.vertx.core.AsyncResult;
import io.vertx.core.Future;
import io.vertx.core.Promise;
import org.apache.commons.collections4.MapUtils;
import org.apache.commons.lang3.StringUtils;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Chartboost Mediation adapter for Digital Turbine Exchange.
 * <p>
 * Every SDK request is bridged into a Vert.x {@link Future} through a {@link CompletionBridge}, which tolerates
 * the SDK calling back more than once or after the caller went away.
 */
public class DigitalTurbineExchangeAdapter implements PartnerAdapter {

    private static final PartnerLogController partnerLog =
            PartnerLogController.create(DigitalTurbineExchangeAdapter.class);

    private final ExchangeSdk exchangeSdk;
    private final DigitalTurbineExchangeAdapterConfiguration configuration;
    private final JacksonMapper mapper;
    private final String mediatorName;
    private final String mediationVersion;

    private final PartnerAdListenerRegistry listeners = new PartnerAdListenerRegistry();
    private final Map<String, CompletionBridge<PartnerAd>> pendingLoads =
            Collections.synchronizedMap(new HashMap<>());

    private volatile boolean gdprApplies;

    public DigitalTurbineExchangeAdapter(ExchangeSdk exchangeSdk,
                                         DigitalTurbineExchangeAdapterConfiguration configuration,
                                         JacksonMapper mapper,
                                         String mediatorName,
                                         String mediationVersion) {

        this.exchangeSdk = Objects.requireNonNull(exchangeSdk);
        this.configuration = Objects.requireNonNull(configuration);
        this.mapper = Objects.requireNonNull(mapper);
        this.mediatorName = Objects.requireNonNull(mediatorName);
        this.mediationVersion = Objects.requireNonNull(mediationVersion);
    }

    @Override
    public DigitalTurbineExchangeAdapterConfiguration getConfiguration() {
        return configuration;
    }

    @Override
    public Future<Map<String, Object>> setUp(HostContext context, PartnerConfiguration partnerConfiguration) {
        partnerLog.log(PartnerAdapterEvent.SETUP_STARTED);

        final String appId = resolveAppId(partnerConfiguration);
        if (appId == null) {
            partnerLog.log(PartnerAdapterEvent.SETUP_FAILED, "Missing app ID.");
            return failure(MediationError.INITIALIZATION_INVALID_CREDENTIALS);
        }

        final Promise<Map<String, Object>> promise = Promise.promise();
        final CompletionBridge<Map<String, Object>> bridge = CompletionBridge.begin("setUp", promise);
        try {
            exchangeSdk.initialize(context, appId, status -> bridge.resolve(toSetUpResult(status)));
        } catch (RuntimeException e) {
            partnerLog.log(PartnerAdapterEvent.SETUP_FAILED, e.getMessage());
            bridge.fail(new MediationAdException(MediationError.INITIALIZATION_UNKNOWN, e));
        }

        return promise.future();
    }

    private String resolveAppId(PartnerConfiguration partnerConfiguration) {
        final ObjectNode credentials = partnerConfiguration != null ? partnerConfiguration.getCredentials() : null;
        if (credentials == null) {
            return null;
        }

        try {
            final DigitalTurbineExchangeCredentials parsed =
                    mapper.convertValue(credentials, DigitalTurbineExchangeCredentials.class);
            return StringUtils.trimToNull(parsed.getFyberAppId());
        } catch (DecodeException e) {
            partnerLog.log(PartnerAdapterEvent.SETUP_FAILED, e.getMessage());
            return null;
        }
    }

    private static AsyncResult<Map<String, Object>> toSetUpResult(InitStatus status) {
        final MediationError error = ExchangeErrorMapper.toMediationError(status);
        if (error == null) {
            partnerLog.log(PartnerAdapterEvent.SETUP_SUCCEEDED);
            return Future.succeededFuture(Collections.emptyMap());
        }

        partnerLog.log(PartnerAdapterEvent.SETUP_FAILED, "Init status: %s.".formatted(status));
        return Future.failedFuture(new MediationAdException(error));
    }

    @Override
    public void setConsents(HostContext context, Map<String, String> consents, Set<String> modifiedKeys) {
        if (MapUtils.isEmpty(consents)) {
            return;
        }

        final String partnerConsent = StringUtils.trimToNull(consents.get(configuration.getPartnerId()));
        final String consent = partnerConsent != null
                ? partnerConsent
                : StringUtils.trimToNull(consents.get(ConsentKeys.GDPR_CONSENT_GIVEN));
        if (consent != null) {
            applyGdprConsent(consent);
        }

        final String tcfString = consents.get(ConsentKeys.TCF);
        if (tcfString != null) {
            partnerLog.log(PartnerAdapterEvent.CUSTOM, PartnerLogController.PRIVACY_TAG + " TCF String set");
            exchangeSdk.setGdprConsentString(tcfString);
        }

        final String uspString = consents.get(ConsentKeys.USP);
        if (uspString != null) {
            partnerLog.log(PartnerAdapterEvent.CUSTOM, PartnerLogController.PRIVACY_TAG + " USP String: " + uspString);
            exchangeSdk.setUsPrivacyString(uspString);
        }
    }

    private void applyGdprConsent(String consent) {
        if (ConsentValues.DOES_NOT_APPLY.equals(consent)) {
            partnerLog.log(PartnerAdapterEvent.GDPR_NOT_APPLICABLE);
            return;
        }

        partnerLog.log(switch (consent) {
            case ConsentValues.GRANTED -> PartnerAdapterEvent.GDPR_CONSENT_GRANTED;
            case ConsentValues.DENIED -> PartnerAdapterEvent.GDPR_CONSENT_DENIED;
            default -> PartnerAdapterEvent.GDPR_CONSENT_UNKNOWN;
        });

        exchangeSdk.setGdprConsent(ConsentValues.GRANTED.equals(consent));
    }

    @Override
    public void setIsUserUnderage(HostContext context, boolean isUserUnderage) {
        // Digital Turbine Exchange has no API for COPPA
        partnerLog.log(isUserUnderage
                ? PartnerAdapterEvent.USER_IS_UNDERAGE
                : PartnerAdapterEvent.USER_IS_NOT_UNDERAGE);
    }

    @Override
    public void setGdprApplies(HostContext context, boolean gdprApplies) {
        this.gdprApplies = gdprApplies;
    }

    @Override
    public void setGdprConsentStatus(HostContext context, GdprConsentStatus gdprConsentStatus) {
        if (!gdprApplies) {
            partnerLog.log(PartnerAdapterEvent.GDPR_NOT_APPLICABLE);
            exchangeSdk.clearGdprConsentData();
            return;
        }

        final boolean granted = gdprConsentStatus == GdprConsentStatus.GDPR_CONSENT_GRANTED;
        partnerLog.log(granted
                ? PartnerAdapterEvent.GDPR_CONSENT_GRANTED
                : gdprConsentStatus == GdprConsentStatus.GDPR_CONSENT_DENIED
                        ? PartnerAdapterEvent.GDPR_CONSENT_DENIED
                        : PartnerAdapterEvent.GDPR_CONSENT_UNKNOWN);
        exchangeSdk.setGdprConsent(granted);
    }

    @Override
    public void setCcpaConsent(HostContext context, boolean hasGivenCcpaConsent, String privacyString) {
        partnerLog.log(PartnerAdapterEvent.CUSTOM,
                "%s USP String: %s".formatted(PartnerLogController.PRIVACY_TAG, privacyString));
        exchangeSdk.setUsPrivacyString(privacyString);
    }

    @Override
    public Future<Map<String, String>> fetchBidderInformation(HostContext context, PartnerAdPreBidRequest request) {
        partnerLog.log(PartnerAdapterEvent.BIDDER_INFO_FETCH_STARTED);
        partnerLog.log(PartnerAdapterEvent.BIDDER_INFO_FETCH_SUCCEEDED);
        return Future.succeededFuture(Collections.emptyMap());
    }

    @Override
    public Future<PartnerAd> load(HostContext context,
                                  PartnerAdLoadRequest request,
                                  PartnerAdListener partnerAdListener) {

        partnerLog.log(PartnerAdapterEvent.LOAD_STARTED);

        final PartnerAdFormat format = request.getFormat();
        if (format == PartnerAdFormat.BANNER) {
            return loadBannerAd(context, request, partnerAdListener);
        }
        if (format == PartnerAdFormat.INTERSTITIAL || format == PartnerAdFormat.REWARDED) {
            return loadFullscreenAd(request, partnerAdListener);
        }

        partnerLog.log(PartnerAdapterEvent.LOAD_FAILED, "Unsupported ad format: %s.".formatted(format));
        return failure(MediationError.LOAD_UNSUPPORTED_AD_FORMAT);
    }

    private Future<PartnerAd> loadBannerAd(HostContext context,
                                           PartnerAdLoadRequest request,
                                           PartnerAdListener listener) {

        final BannerUnitController unitController = exchangeSdk.createBannerUnitController();
        final AdSpot adSpot = createSpot(unitController);

        final Promise<PartnerAd> promise = Promise.promise();
        final CompletionBridge<PartnerAd> bridge = CompletionBridge.begin("loadBanner", promise);
        adSpot.setRequestListener(new BannerAdLoadListener(bridge, adSpot, request, context, listener));

        return requestAd(adSpot, request, bridge, promise);
    }

    private Future<PartnerAd> loadFullscreenAd(PartnerAdLoadRequest request, PartnerAdListener listener) {
        listeners.register(request.getIdentifier(), listener);

        final FullscreenUnitController unitController = exchangeSdk.createFullscreenUnitController();
        final AdSpot adSpot = createSpot(unitController);

        final Promise<PartnerAd> promise = Promise.promise();
        final CompletionBridge<PartnerAd> bridge = CompletionBridge.begin("loadFullscreen", promise);
        adSpot.setRequestListener(new FullscreenAdLoadListener(bridge, adSpot, request));

        return requestAd(adSpot, request, bridge, promise)
                .onFailure(ignored -> listeners.remove(request.getIdentifier()));
    }

    private AdSpot createSpot(UnitController unitController) {
        final AdSpot adSpot = exchangeSdk.createSpot();
        adSpot.addUnitController(unitController);
        adSpot.setMediationName(mediatorName);
        adSpot.setMediationVersion(mediationVersion);
        return adSpot;
    }

    private Future<PartnerAd> requestAd(AdSpot adSpot,
                                        PartnerAdLoadRequest request,
                                        CompletionBridge<PartnerAd> bridge,
                                        Promise<PartnerAd> promise) {

        trackPendingLoad(request.getIdentifier(), bridge);
        try {
            adSpot.requestAd(AdRequest.of(request.getPartnerPlacement()));
        } catch (RuntimeException e) {
            partnerLog.log(PartnerAdapterEvent.LOAD_FAILED, e.getMessage());
            bridge.fail(new MediationAdException(MediationError.OTHER_PARTNER_ERROR, e));
            adSpot.destroy();
        }

        return promise.future();
    }

    private void trackPendingLoad(String identifier, CompletionBridge<PartnerAd> bridge) {
        synchronized (pendingLoads) {
            pendingLoads.values().removeIf(pending -> !pending.isPending());
            if (identifier != null) {
                pendingLoads.put(identifier, bridge);
            }
        }
    }

    @Override
    public Future<PartnerAd> show(HostActivity activity, PartnerAd partnerAd) {
        partnerLog.log(PartnerAdapterEvent.SHOW_STARTED);

        final PartnerAdLoadRequest request = partnerAd.getRequest();
        if (request == null) {
            partnerLog.log(PartnerAdapterEvent.SHOW_FAILED, "Ad has no load request.");
            return failure(MediationError.SHOW_UNKNOWN);
        }

        final PartnerAdListener listener = listeners.remove(request.getIdentifier());

        final PartnerAdFormat format = request.getFormat();
        if (format == PartnerAdFormat.BANNER) {
            // banners have no separate show
            partnerLog.log(PartnerAdapterEvent.SHOW_SUCCEEDED);
            return Future.succeededFuture(partnerAd);
        }
        if (format == PartnerAdFormat.INTERSTITIAL || format == PartnerAdFormat.REWARDED) {
            return showFullscreenAd(activity, partnerAd, listener);
        }

        partnerLog.log(PartnerAdapterEvent.SHOW_FAILED, "Unsupported ad format: %s.".formatted(format));
        return failure(MediationError.SHOW_UNSUPPORTED_AD_FORMAT);
    }

    private Future<PartnerAd> showFullscreenAd(HostActivity activity,
                                               PartnerAd partnerAd,
                                               PartnerAdListener listener) {

        if (!(partnerAd.getAd() instanceof AdSpot adSpot)) {
            partnerLog.log(PartnerAdapterEvent.SHOW_FAILED, "Ad is not an AdSpot.");
            return failure(MediationError.SHOW_WRONG_RESOURCE_TYPE);
        }

        if (!adSpot.isReady()) {
            partnerLog.log(PartnerAdapterEvent.SHOW_FAILED, "Ad is not ready.");
            return failure(MediationError.SHOW_AD_NOT_READY);
        }

        if (!(adSpot.getSelectedUnitController() instanceof FullscreenUnitController controller)) {
            partnerLog.log(PartnerAdapterEvent.SHOW_FAILED, "Selected unit controller is not a fullscreen controller.");
            return failure(MediationError.SHOW_WRONG_RESOURCE_TYPE);
        }

        final Promise<PartnerAd> promise = Promise.promise();
        final CompletionBridge<PartnerAd> bridge = CompletionBridge.begin("showFullscreen", promise);
        final FullscreenAdShowListener showListener = new FullscreenAdShowListener(bridge, listener, partnerAd);
        controller.setEventsListener(showListener);
        controller.setRewardedListener(showListener);

        try {
            controller.show(activity);
        } catch (RuntimeException e) {
            partnerLog.log(PartnerAdapterEvent.SHOW_FAILED, e.getMessage());
            bridge.fail(new MediationAdException(MediationError.SHOW_UNKNOWN, e));
        }

        return promise.future();
    }

    @Override
    public Future<PartnerAd> invalidate(PartnerAd partnerAd) {
        partnerLog.log(PartnerAdapterEvent.INVALIDATE_STARTED);

        final String identifier = partnerAd.getRequest() != null ? partnerAd.getRequest().getIdentifier() : null;
        listeners.remove(identifier);
        cancelPendingLoad(identifier);

        return destroyAd(partnerAd);
    }

    private void cancelPendingLoad(String identifier) {
        final CompletionBridge<PartnerAd> pending = identifier != null ? pendingLoads.remove(identifier) : null;
        if (pending != null && pending.cancel()) {
            partnerLog.log(PartnerAdapterEvent.CUSTOM, "Cancelled pending load %s.".formatted(identifier));
        }
    }

    private static Future<PartnerAd> destroyAd(PartnerAd partnerAd) {
        final Object ad = partnerAd.getAd();
        if (ad == null) {
            partnerLog.log(PartnerAdapterEvent.INVALIDATE_FAILED, "Ad is null.");
            return failure(MediationError.INVALIDATE_AD_NOT_FOUND);
        }

        if (ad instanceof BannerView bannerView) {
            bannerView.getSpot().destroy();
        } else if (ad instanceof AdSpot adSpot) {
            adSpot.destroy();
        } else {
            partnerLog.log(PartnerAdapterEvent.INVALIDATE_FAILED, "Ad is neither a BannerView nor an AdSpot.");
            return failure(MediationError.INVALIDATE_WRONG_RESOURCE_TYPE);
        }

        partnerLog.log(PartnerAdapterEvent.INVALIDATE_SUCCEEDED);
        return Future.succeededFuture(partnerAd);
    }

    private static <T> Future<T> failure(MediationError error) {
        return Future.failedFuture(new MediationAdException(error));
    }
}
