package com.kmg.repost.service;

import com.kmg.repost.config.RepostProperties;
import com.kmg.repost.model.ActionOutcome;
import com.microsoft.playwright.Browser;
import com.microsoft.playwright.BrowserContext;
import com.microsoft.playwright.BrowserType;
import com.microsoft.playwright.Locator;
import com.microsoft.playwright.Page;
import com.microsoft.playwright.Playwright;
import com.microsoft.playwright.PlaywrightException;
import com.microsoft.playwright.options.AriaRole;
import com.microsoft.playwright.options.WaitUntilState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Re-posts a listing by driving a headless Chromium session. Login state is kept in a
 * storage-state file between runs when {@code repost.action.session-state-path} is set.
 */
@Service
public class PlaywrightRepostExecutor implements ActionExecutor {
    private static final Logger log = LoggerFactory.getLogger(PlaywrightRepostExecutor.class);

    static final String MISSING_CREDENTIALS = "Missing LBC_EMAIL or LBC_PASSWORD in environment";
    static final String BUTTON_NOT_FOUND = "Repost button not found";

    private static final Pattern COOKIE_BUTTON = Pattern.compile("accepter|tout accepter|j'accepte", Pattern.CASE_INSENSITIVE);
    private static final Pattern EMAIL_LABEL = Pattern.compile("e-mail|email|adresse e-mail", Pattern.CASE_INSENSITIVE);
    private static final Pattern PASSWORD_LABEL = Pattern.compile("mot de passe|password", Pattern.CASE_INSENSITIVE);
    private static final Pattern LOGIN_BUTTON = Pattern.compile("se connecter|connexion|connecter", Pattern.CASE_INSENSITIVE);
    private static final Pattern CONFIRM_BUTTON = Pattern.compile("(confirmer|valider|oui|ok|continuer)", Pattern.CASE_INSENSITIVE);
    private static final String ACCOUNT_MARKER = "a[href*='/compte/'], [data-qa-id*='header-account']";

    private final RepostProperties properties;

    public PlaywrightRepostExecutor(RepostProperties properties) {
        this.properties = properties;
    }

    @Override
    public ActionOutcome execute(String target) {
        RepostProperties.Action action = properties.getAction();
        if (isBlank(action.getEmail()) || isBlank(action.getPassword())) {
            return ActionOutcome.failed(MISSING_CREDENTIALS);
        }

        try (Playwright playwright = Playwright.create();
             Browser browser = playwright.chromium().launch(new BrowserType.LaunchOptions().setHeadless(action.isHeadless()));
             BrowserContext context = browser.newContext(contextOptions())) {
            Page page = context.newPage();
            ensureLoggedIn(page, action);

            page.navigate(target, new Page.NavigateOptions().setWaitUntil(WaitUntilState.DOMCONTENTLOADED));
            page.waitForTimeout(action.getPageSettle().toMillis());

            if (!clickRepostControl(page, action.getButtonLabels())) {
                return ActionOutcome.failed(BUTTON_NOT_FOUND);
            }

            page.waitForTimeout(action.getConfirmSettle().toMillis());
            clickIfPresent(page.getByRole(AriaRole.BUTTON, new Page.GetByRoleOptions().setName(CONFIRM_BUTTON)));
            page.waitForTimeout(action.getFinalSettle().toMillis());

            saveSession(context);
            return ActionOutcome.succeeded("Clicked repost flow");
        } catch (PlaywrightException e) {
            log.warn("Repost flow failed for {}: {}", target, e.getMessage());
            return ActionOutcome.failed(describe(e));
        } catch (RuntimeException e) {
            log.error("Unexpected repost failure for {}: {}", target, e.getMessage(), e);
            return ActionOutcome.failed(describe(e));
        }
    }

    private Browser.NewContextOptions contextOptions() {
        Browser.NewContextOptions options = new Browser.NewContextOptions();
        Path sessionPath = sessionStatePath();
        if (sessionPath != null && Files.exists(sessionPath)) {
            options.setStorageStatePath(sessionPath);
        }
        return options;
    }

    private void ensureLoggedIn(Page page, RepostProperties.Action action) {
        page.navigate(action.getHomeUrl());
        try {
            page.getByRole(AriaRole.BUTTON, new Page.GetByRoleOptions().setName(COOKIE_BUTTON))
                    .click(new Locator.ClickOptions().setTimeout(action.getCookieBannerTimeout().toMillis()));
        } catch (PlaywrightException e) {
            log.debug("No cookie banner: {}", e.getMessage());
        }

        if (page.locator(ACCOUNT_MARKER).first().count() > 0) {
            return;
        }

        log.info("No active session; logging in");
        page.navigate(action.getLoginUrl());
        page.getByLabel(EMAIL_LABEL).fill(action.getEmail());
        page.getByLabel(PASSWORD_LABEL).fill(action.getPassword());
        page.getByRole(AriaRole.BUTTON, new Page.GetByRoleOptions().setName(LOGIN_BUTTON)).click();
        page.waitForTimeout(action.getLoginSettle().toMillis());
    }

    private boolean clickRepostControl(Page page, List<String> labels) {
        for (String label : labels) {
            Pattern name = Pattern.compile(Pattern.quote(label), Pattern.CASE_INSENSITIVE);
            if (clickIfPresent(page.getByRole(AriaRole.BUTTON, new Page.GetByRoleOptions().setName(name)))) {
                return true;
            }
            if (clickIfPresent(page.getByRole(AriaRole.LINK, new Page.GetByRoleOptions().setName(name)))) {
                return true;
            }
        }

        // Fallback for controls without an accessible role.
        Object found = page.evaluate(
                """
                (source) => {
                  const re = new RegExp(source, 'i');
                  const els = Array.from(document.querySelectorAll("button, a, div[role='button']"));
                  const target = els.find(el => re.test((el.innerText || el.textContent || '').trim()));
                  if (target) { target.click(); return true; }
                  return false;
                }
                """,
                labelAlternation(labels)
        );
        return Boolean.TRUE.equals(found);
    }

    private boolean clickIfPresent(Locator locator) {
        if (locator.count() == 0) {
            return false;
        }
        locator.first().click();
        return true;
    }

    private void saveSession(BrowserContext context) {
        Path sessionPath = sessionStatePath();
        if (sessionPath == null) {
            return;
        }
        try {
            context.storageState(new BrowserContext.StorageStateOptions().setPath(sessionPath));
        } catch (PlaywrightException e) {
            log.warn("Failed to persist browser session to {}: {}", sessionPath, e.getMessage());
        }
    }

    private Path sessionStatePath() {
        String value = properties.getAction().getSessionStatePath();
        return isBlank(value) ? null : Path.of(value);
    }

    static String labelAlternation(List<String> labels) {
        return labels.stream()
                .map(label -> label.toLowerCase().replaceAll("[.*+?^${}()|\\[\\]\\\\]", "\\\\$0"))
                .collect(Collectors.joining("|", "(", ")"));
    }

    private static String describe(RuntimeException e) {
        return e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
