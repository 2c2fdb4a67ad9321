package io.tripdata.sync.discovery;

/*
 * Copyright (c) nosqlbench
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *   http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing,
 * software distributed under the License is distributed on an
 * "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY
 * KIND, either express or implied.  See the License for the
 * specific language governing permissions and limitations
 * under the License.
 */

import io.tripdata.api.Backend;
import io.tripdata.api.DatasetDiscovery;
import io.tripdata.api.DiscoveryException;
import io.tripdata.api.Fragment;
import io.tripdata.api.SelectionCriteria;
import io.tripdata.api.SourceDescriptor;
import io.tripdata.api.TripFileName;
import io.tripdata.sync.DatasetLocations;
import okhttp3.HttpUrl;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;
import okhttp3.ResponseBody;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;

import java.io.IOException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/// Discovers trip files from the links of a published HTML page.
///
/// Without selection criteria every matching link becomes a fragment. With criteria, one
/// candidate is produced per requested month: the scraped link with the expected file name when
/// the page has one, otherwise the URL built from the CloudFront base and the naming template.
/// A candidate that does not exist remotely fails later, during sync, for that month only.
public class WebDatasetDiscovery implements DatasetDiscovery {
    private static final Logger logger = LogManager.getLogger(WebDatasetDiscovery.class);

    static final String TRIP_EXTENSION = "parquet";

    private final OkHttpClient client;
    private final DatasetLocations locations;

    /// @param client HTTP client used to fetch the page
    /// @param locations selector and CloudFront base
    public WebDatasetDiscovery(OkHttpClient client, DatasetLocations locations) {
        this.client = client;
        this.locations = locations;
    }

    @Override
    public List<Fragment> discover(SourceDescriptor descriptor) throws DiscoveryException {
        if (descriptor.backend() != Backend.WEB) {
            throw new IllegalArgumentException("Not a web source: " + descriptor);
        }
        Set<String> links = scrapeLinks(descriptor.location());
        logger.debug("Scraped {} trip links from {}", links.size(), descriptor.location());

        List<Fragment> fragments = new ArrayList<>();
        if (descriptor.selection().isEmpty()) {
            for (String link : links) {
                fragments.add(Fragment.web(link));
            }
            return fragments;
        }

        Map<String, String> byName = new LinkedHashMap<>();
        for (String link : links) {
            byName.putIfAbsent(TripFileName.baseName(link), link);
        }
        SelectionCriteria criteria = descriptor.selection().get();
        for (int month : criteria.months()) {
            String name = TripFileName.format(criteria.recordType(), criteria.year(), month, TRIP_EXTENSION);
            String url = byName.get(name);
            if (url == null) {
                url = locations.cloudFrontUrl(name);
                logger.debug("{} is not linked from the page, using {}", name, url);
            }
            fragments.add(Fragment.web(url));
        }
        return fragments;
    }

    /// Fetch a page and collect the trimmed, absolute targets of the configured links.
    ///
    /// @param pageUrl page to scrape
    /// @return links in page order, without duplicates
    /// @throws DiscoveryException if the page cannot be fetched
    public Set<String> scrapeLinks(String pageUrl) throws DiscoveryException {
        HttpUrl base = HttpUrl.parse(pageUrl);
        if (base == null) {
            throw new DiscoveryException(pageUrl, "Invalid page URL", null);
        }
        String html;
        Request request = new Request.Builder().url(base).get().build();
        try (Response response = client.newCall(request).execute()) {
            if (!response.isSuccessful()) {
                throw new DiscoveryException(pageUrl, "Page request returned HTTP " + response.code(), null);
            }
            ResponseBody body = response.body();
            html = body == null ? "" : body.string();
        } catch (DiscoveryException e) {
            throw e;
        } catch (IOException e) {
            throw new DiscoveryException(pageUrl, "Page request failed", e);
        }

        Document document = Jsoup.parse(html, pageUrl);
        Set<String> links = new LinkedHashSet<>();
        for (Element anchor : document.select(locations.linkSelector())) {
            String href = anchor.attr("href").trim();
            if (href.isEmpty()) {
                continue;
            }
            HttpUrl resolved = base.resolve(href);
            if (resolved == null) {
                logger.debug("Ignoring unresolvable link '{}'", href);
                continue;
            }
            links.add(resolved.toString());
        }
        return links;
    }
}
