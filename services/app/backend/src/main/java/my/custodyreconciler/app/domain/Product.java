package my.custodyreconciler.app.domain;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;

import java.time.LocalDateTime;

@Entity
@Table(name = "products")
public class Product {
	@Id
	@GeneratedValue(strategy = GenerationType.IDENTITY)
	@Column(name = "product_id")
	private Long productId;

	@Column(name = "isin", nullable = false)
	private String isin;

	@Column(name = "title", nullable = false)
	private String title;

	@Column(name = "template_id")
	private String templateId;

	@Column(name = "asset_class")
	private String assetClass;

	@Column(name = "issuer")
	private String issuer;

	@Column(name = "underlying_type")
	private String underlyingType;

	@Column(name = "protection_type")
	private String protectionType;

	@Column(name = "capital_guaranteed_100")
	private Boolean capitalGuaranteed100;

	@Column(name = "capital_guaranteed_partial")
	private Boolean capitalGuaranteedPartial;

	@Column(name = "barrier_protected")
	private Boolean barrierProtected;

	@Column(name = "created_at", nullable = false)
	private LocalDateTime createdAt;

	public Long getProductId() {
		return productId;
	}

	public void setProductId(Long productId) {
		this.productId = productId;
	}

	public String getIsin() {
		return isin;
	}

	public void setIsin(String isin) {
		this.isin = isin;
	}

	public String getTitle() {
		return title;
	}

	public void setTitle(String title) {
		this.title = title;
	}

	public String getTemplateId() {
		return templateId;
	}

	public void setTemplateId(String templateId) {
		this.templateId = templateId;
	}

	public String getAssetClass() {
		return assetClass;
	}

	public void setAssetClass(String assetClass) {
		this.assetClass = assetClass;
	}

	public String getIssuer() {
		return issuer;
	}

	public void setIssuer(String issuer) {
		this.issuer = issuer;
	}

	public String getUnderlyingType() {
		return underlyingType;
	}

	public void setUnderlyingType(String underlyingType) {
		this.underlyingType = underlyingType;
	}

	public String getProtectionType() {
		return protectionType;
	}

	public void setProtectionType(String protectionType) {
		this.protectionType = protectionType;
	}

	public Boolean getCapitalGuaranteed100() {
		return capitalGuaranteed100;
	}

	public void setCapitalGuaranteed100(Boolean capitalGuaranteed100) {
		this.capitalGuaranteed100 = capitalGuaranteed100;
	}

	public Boolean getCapitalGuaranteedPartial() {
		return capitalGuaranteedPartial;
	}

	public void setCapitalGuaranteedPartial(Boolean capitalGuaranteedPartial) {
		this.capitalGuaranteedPartial = capitalGuaranteedPartial;
	}

	public Boolean getBarrierProtected() {
		return barrierProtected;
	}

	public void setBarrierProtected(Boolean barrierProtected) {
		this.barrierProtected = barrierProtected;
	}

	public LocalDateTime getCreatedAt() {
		return createdAt;
	}

	public void setCreatedAt(LocalDateTime createdAt) {
		this.createdAt = createdAt;
	}
}
