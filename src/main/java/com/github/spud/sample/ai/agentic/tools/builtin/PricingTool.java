package com.github.spud.sample.ai.agentic.tools.builtin;

import com.github.spud.sample.ai.agentic.tools.Tool;
import com.github.spud.sample.ai.agentic.tools.ToolDescriptor;
import com.github.spud.sample.ai.agentic.tools.ToolInvocationContext;
import com.github.spud.sample.ai.agentic.tools.builtin.PricingCatalog.PriceItem;
import java.util.List;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * 官方价格查询工具 按服务类别查询，提供 query 时走模糊搜索
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class PricingTool implements Tool {

  public static final String NAME = "get_pricing";

  private static final ToolDescriptor DESCRIPTOR = new ToolDescriptor(NAME,
    "Get OFFICIAL pricing for services. ALWAYS use this for price questions. "
      + "Returns prices for Visa, KITAS, Business Setup, Tax and Legal services.",
    """
      {
        "type": "object",
        "properties": {
          "service_type": {
            "type": "string",
            "enum": ["visa", "kitas", "business_setup", "tax_consulting", "legal", "all"],
            "description": "Type of service to get pricing for"
          },
          "query": {
            "type": "string",
            "description": "Optional specific search query (e.g. 'investor kitas')"
          }
        }
      }
      """,
    "service_type");

  private final PricingCatalog catalog;

  @Override
  public ToolDescriptor descriptor() {
    return DESCRIPTOR;
  }

  @Override
  public String execute(Map<String, String> arguments, ToolInvocationContext context) {
    String query = arguments.get("query");
    String serviceType = arguments.getOrDefault("service_type", "all").trim().toLowerCase();
    try {
      if (query != null && !query.isBlank()) {
        List<PriceItem> matches = catalog.search(query);
        if (!matches.isEmpty()) {
          return "Pricing matches for '" + query + "':\n" + formatItems(matches);
        }
        log.debug("No fuzzy pricing match for '{}', falling back to {}", query, serviceType);
      }

      StringBuilder sb = new StringBuilder();
      catalog.byCategory(serviceType).forEach((category, items) -> {
        if (sb.length() > 0) {
          sb.append("\n\n");
        }
        sb.append("Official pricing (").append(category).append("):\n").append(formatItems(items));
      });
      return sb.toString();
    } catch (RuntimeException e) {
      log.error("Pricing lookup failed: {}", e.getMessage(), e);
      return "Pricing lookup failed: " + e.getMessage();
    }
  }

  private String formatItems(List<PriceItem> items) {
    StringBuilder sb = new StringBuilder();
    for (PriceItem item : items) {
      if (sb.length() > 0) {
        sb.append("\n");
      }
      sb.append("- ").append(item.name()).append(": Rp ").append(CalculatorTool.rupiah(item.price()));
      if (item.notes() != null && !item.notes().isBlank()) {
        sb.append(" (").append(item.notes()).append(")");
      }
    }
    return sb.toString();
  }
}
