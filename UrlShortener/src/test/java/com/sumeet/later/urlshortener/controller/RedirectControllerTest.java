package com.sumeet.later.urlshortener.controller;

import com.sumeet.later.urlshortener.exception.MappingNotFoundException;
import com.sumeet.later.urlshortener.exception.UnauthorizedAccessException;
import com.sumeet.later.urlshortener.model.UrlMapping;
import com.sumeet.later.urlshortener.service.MappingService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.QueryTimeoutException;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.content;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@ExtendWith(MockitoExtension.class)
class RedirectControllerTest {

    @Mock
    private MappingService mappingService;

    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        mockMvc = MockMvcBuilders.standaloneSetup(new RedirectController(mappingService)).build();
    }

    @Test
    void testRedirect_LiveMapping() throws Exception {
        when(mappingService.resolve("Ab3dE", null))
                .thenReturn(UrlMapping.builder().shortUrl("Ab3dE").longUrl("https://example.com/a").build());

        mockMvc.perform(get("/api/Ab3dE"))
                .andExpect(status().isFound())
                .andExpect(header().string("Location", "https://example.com/a"));
    }

    @Test
    void testRedirect_EveryFailureLooksLikeNotFound() throws Exception {
        when(mappingService.resolve("gone1", null)).thenThrow(new MappingNotFoundException("gone1"));
        when(mappingService.resolve("other", null)).thenThrow(new UnauthorizedAccessException("other"));
        when(mappingService.resolve("error", null)).thenThrow(new QueryTimeoutException("redis timed out"));

        for (String code : new String[]{"gone1", "other", "error"}) {
            mockMvc.perform(get("/api/" + code))
                    .andExpect(status().isNotFound())
                    .andExpect(content().string(RedirectController.NOT_FOUND_BODY));
        }
    }
}
