package me.golemcore.modbot.adapter.outbound.site;

import feign.Headers;
import feign.Param;
import feign.QueryMap;
import feign.RequestLine;

import java.util.List;
import java.util.Map;

/**
 * Feign contract for the site API endpoints the bot uses. Authentication is
 * attached by the client factory.
 */
public interface SiteApi {

    @RequestLine("GET /bot/infractions")
    @Headers("Accept: application/json")
    List<SiteInfraction> listInfractions(@QueryMap Map<String, Object> filters);

    @RequestLine("GET /bot/infractions/{id}")
    @Headers("Accept: application/json")
    SiteInfraction getInfraction(@Param("id") long id);

    @RequestLine("POST /bot/infractions")
    @Headers({ "Accept: application/json", "Content-Type: application/json" })
    SiteInfraction createInfraction(SiteInfraction draft);

    @RequestLine("PATCH /bot/infractions/{id}")
    @Headers({ "Accept: application/json", "Content-Type: application/json" })
    SiteInfraction updateInfraction(@Param("id") long id, Map<String, Object> changes);

    @RequestLine("DELETE /bot/infractions/{id}")
    void deleteInfraction(@Param("id") long id);

    @RequestLine("POST /bot/deleted-messages")
    @Headers({ "Accept: application/json", "Content-Type: application/json" })
    DeletedMessageLog uploadDeletedMessages(DeletedMessageLog log);
}
